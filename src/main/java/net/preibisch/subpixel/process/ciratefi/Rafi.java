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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.subpixel.Threads;
import net.preibisch.subpixel.process.patch.Patch;
import net.preibisch.subpixel.process.projection.AngleSet;
import net.preibisch.subpixel.process.projection.RadialProjection;

/**
 * Radial sampling filter: estimates the rotation of every CIFI survivor by comparing radial
 * projections under all rotation hypotheses, then filters the positions by their best score.
 */
public class Rafi
{
	private static final Logger LOG = LoggerFactory.getLogger( Rafi.class );

	public static RadialProjection[] templateProjections(
			final Patch template,
			final int[] radii,
			final double[] scales,
			final AngleSet angles )
	{
		final RadialProjection[] projections = new RadialProjection[ scales.length ];
		final Patch.Sampler sampler = template.sampler();

		for ( int s = 0; s < scales.length; ++s )
			projections[ s ] = RadialProjection.compute(
					sampler, template.getCenterX(), template.getCenterY(), radii, scales[ s ], angles.getAlpha(), angles.size() );

		return projections;
	}

	/**
	 * @param window - the search window
	 * @param candidates - CIFI survivors
	 * @param template - template projections, one per scale
	 * @param radii - ring radii
	 * @param angles - rotation hypotheses
	 * @param threshold - survival threshold
	 * @param service - executor
	 * @return survivors annotated with their best rotation, in input order
	 * @throws DegenerateInputException if the template has no angular structure at the scale of any candidate
	 */
	public static StageResult filter(
			final Patch window,
			final List< Candidate > candidates,
			final RadialProjection[] template,
			final int[] radii,
			final AngleSet angles,
			final Threshold threshold,
			final ExecutorService service ) throws DegenerateInputException
	{
		final boolean[] informative = new boolean[ template.length ];
		boolean anyInformative = false;

		for ( final Candidate c : candidates )
		{
			informative[ c.getScaleIndex() ] = template[ c.getScaleIndex() ].isInformative();
			anyInformative |= informative[ c.getScaleIndex() ];
		}

		if ( !candidates.isEmpty() && !anyInformative )
			throw new DegenerateInputException( "Radial projection of the template is constant, the rotation is undefined." );

		final int numRotations = angles.size();

		// the window is sampled far enough so that every rotation is a plain shift of the angle index
		final int numWindowAngles = 2 * numRotations - 1;

		final ArrayList< Callable< List< Candidate > > > tasks = new ArrayList<>();

		for ( final int[] range : Threads.splitRange( candidates.size(), Threads.numThreads() * 4 ) )
		{
			tasks.add( () ->
			{
				final Patch.Sampler sampler = window.sampler();
				final ArrayList< Candidate > scored = new ArrayList<>();

				for ( int i = range[ 0 ]; i < range[ 1 ]; ++i )
				{
					final Candidate c = candidates.get( i );

					if ( !informative[ c.getScaleIndex() ] )
						continue;

					final RadialProjection local = RadialProjection.compute(
							sampler, c.getX(), c.getY(), radii, 1.0, angles.getAlpha(), numWindowAngles );

					final double[] scores = new double[ numRotations ];

					for ( int q = 0; q < numRotations; ++q )
						scores[ q ] = template[ c.getScaleIndex() ].correlate( local, q );

					final int bestRotation = bestRotation( scores );

					if ( bestRotation >= 0 )
						scored.add( c.withRotation( bestRotation, scores[ bestRotation ] ) );
				}

				return scored;
			} );
		}

		final ArrayList< Candidate > scored = new ArrayList<>();

		for ( final List< Candidate > partial : Threads.execTasks( tasks, service, "compute radial projections" ) )
			scored.addAll( partial );

		final double cutoff = threshold.resolve( Threshold.scores( scored ) );
		final List< Candidate > survivors = Threshold.filter( scored, cutoff );

		final StageResult result = new StageResult( Stage.RAFI, candidates.size(), scored, cutoff, survivors );

		LOG.debug( "{}", result );

		return result;
	}

	/**
	 * @param scores - score per rotation hypothesis, NaN if undefined
	 * @return index of the highest defined score, the smallest index among equal scores; -1 if none is defined
	 */
	public static int bestRotation( final double[] scores )
	{
		int best = -1;

		for ( int q = 0; q < scores.length; ++q )
			if ( !Double.isNaN( scores[ q ] ) && ( best < 0 || scores[ q ] > scores[ best ] ) )
				best = q;

		return best;
	}
}
