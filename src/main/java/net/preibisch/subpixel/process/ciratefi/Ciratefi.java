/*-
 * #%L
 * Rotation and scale tolerant subpixel registration of image patches
 * using circular and radial projections (CIRATEFI).
 * %%
 * Copyright (C) 2012 - 2025 Subpixel Registration developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.subpixel.process.ciratefi;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.preibisch.subpixel.Threads;
import net.preibisch.subpixel.process.patch.Patch;
import net.preibisch.subpixel.process.projection.AngleSet;
import net.preibisch.subpixel.process.projection.CircularProjection;
import net.preibisch.subpixel.process.projection.RadialProjection;

/**
 * Rotation and scale tolerant subpixel registration of a template patch inside a larger search
 * window (CIRATEFI): circular sampling filter, radial sampling filter and template matching
 * filter, each narrowing the candidates of the previous one.
 *
 * A call is a single deterministic pass; the result does not depend on the executor or the
 * number of threads.
 */
public class Ciratefi
{
	private static final Logger LOG = LoggerFactory.getLogger( Ciratefi.class );

	public static < T extends RealType< T >, S extends RealType< S > > RegistrationResult register(
			final RandomAccessibleInterval< T > template,
			final RandomAccessibleInterval< S > window,
			final CiratefiParameters params ) throws CiratefiException
	{
		return register( Patch.wrap( template ), Patch.wrap( window ), params );
	}

	public static RegistrationResult register(
			final Patch template,
			final Patch window,
			final CiratefiParameters params ) throws CiratefiException
	{
		final ExecutorService service = Threads.createFixedExecutorService();

		try
		{
			return register( template, window, params, service );
		}
		finally
		{
			service.shutdown();
		}
	}

	/**
	 * @param template - the template, its center is the reference point
	 * @param window - the search window, its center is the reference point of the offset
	 * @param params - the configuration
	 * @param service - executor used for all stages, not shut down
	 * @return the registration or the stage at which no candidate survived
	 * @throws InvalidConfigurationException if the parameters are invalid for these patches
	 * @throws DegenerateInputException if template or window carry no usable signal
	 */
	public static RegistrationResult register(
			final Patch template,
			final Patch window,
			final CiratefiParameters params,
			final ExecutorService service ) throws CiratefiException
	{
		final long time = System.currentTimeMillis();

		params.validate( template );
		checkInput( template, window, params.getMaxRadius() );

		final int[] radii = params.getRadii();
		final double[] scales = params.getScales();
		final AngleSet angles = params.getAngleSet();
		final int maxRadius = params.getMaxRadius();

		final int[] survivors = new int[ Stage.values().length ];
		Arrays.fill( survivors, -1 );

		// CIFI
		final CircularProjection[] circular = Cifi.templateProjections( template, radii, scales );
		final StageResult cifi = Cifi.filter( window, circular, radii, params.getCifiThreshold(), service );
		final int evaluated = cifi.getNumEvaluated();
		survivors[ Stage.CIFI.ordinal() ] = cifi.getSurvivors().size();

		if ( cifi.isExhausted() )
			return exhausted( cifi, evaluated, survivors );

		// RAFI
		final RadialProjection[] radial = Rafi.templateProjections( template, radii, scales, angles );
		final StageResult rafi = Rafi.filter( window, cifi.getSurvivors(), radial, radii, angles, params.getRafiThreshold(), service );
		survivors[ Stage.RAFI.ordinal() ] = rafi.getSurvivors().size();

		if ( rafi.isExhausted() )
			return exhausted( rafi, evaluated, survivors );

		// TEFI
		final StageResult tefi = Tefi.filter( template, window, rafi.getSurvivors(), scales, angles, maxRadius, params.getTefiThreshold(), service );
		survivors[ Stage.TEFI.ordinal() ] = tefi.getSurvivors().size();

		if ( tefi.isExhausted() )
			return exhausted( tefi, evaluated, survivors );

		final Candidate best = Tefi.selectBest( tefi.getSurvivors(), window );
		final double[] peak = Tefi.localize( template, window, best, scales, angles, maxRadius, params.getUpsampling() );

		final RegistrationResult result = RegistrationResult.success(
				peak[ 0 ] - window.getCenterX(),
				peak[ 1 ] - window.getCenterY(),
				angles.angle( best.getRotationIndex() ),
				scales[ best.getScaleIndex() ],
				peak[ 2 ],
				evaluated,
				survivors );

		LOG.info( "{} ({} ms)", result, System.currentTimeMillis() - time );

		return result;
	}

	protected static void checkInput( final Patch template, final Patch window, final int maxRadius ) throws DegenerateInputException
	{
		if ( template.isConstant() )
			throw new DegenerateInputException( "Template has zero variance." );

		if ( window.isConstant() )
			throw new DegenerateInputException( "Search window has zero variance." );

		final int minSize = 2 * maxRadius + 1;

		if ( window.getWidth() < minSize || window.getHeight() < minSize )
			throw new DegenerateInputException(
					"Search window " + window.getWidth() + "x" + window.getHeight() + " is too small for radius " + maxRadius +
					", needs at least " + minSize + "x" + minSize );
	}

	protected static RegistrationResult exhausted( final StageResult stage, final int evaluated, final int[] survivors )
	{
		final String reason;
		final List< Candidate > scored = stage.getScored();

		if ( scored.isEmpty() )
			reason = "none of " + stage.getNumEvaluated() + " candidates could be scored";
		else
			reason = "no candidate reached the cutoff " + stage.getCutoff() + " (best score " + max( scored ) + ")";

		final RegistrationResult result = RegistrationResult.failed( stage.getStage(), reason, evaluated, survivors );

		LOG.info( "{}", result );

		return result;
	}

	private static double max( final List< Candidate > candidates )
	{
		double max = Double.NEGATIVE_INFINITY;

		for ( final Candidate c : candidates )
			max = Math.max( max, c.getScore() );

		return max;
	}
}
