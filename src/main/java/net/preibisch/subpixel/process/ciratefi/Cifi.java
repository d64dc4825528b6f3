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
import net.preibisch.subpixel.process.projection.CircularProjection;

/**
 * Circular sampling filter: screens every admissible window position by correlating its
 * circular projection with the template's circular projection at every scale.
 */
public class Cifi
{
	private static final Logger LOG = LoggerFactory.getLogger( Cifi.class );

	/**
	 * @param template - the template
	 * @param radii - ring radii
	 * @param scales - scale hypotheses
	 * @return one circular projection per scale, around the template center
	 * @throws DegenerateInputException if the projection is flat at every scale
	 */
	public static CircularProjection[] templateProjections(
			final Patch template,
			final int[] radii,
			final double[] scales ) throws DegenerateInputException
	{
		final CircularProjection[] projections = new CircularProjection[ scales.length ];
		boolean informative = false;

		for ( int s = 0; s < scales.length; ++s )
		{
			projections[ s ] = CircularProjection.compute( template, template.getCenterX(), template.getCenterY(), radii, scales[ s ] );
			informative |= projections[ s ].isInformative();
		}

		if ( !informative )
			throw new DegenerateInputException( "Circular projection of the template is constant at every scale, no position can be scored." );

		return projections;
	}

	/**
	 * Scores all positions (x, y) of the window with maxRadius &lt;= x &lt; width - maxRadius (same for y).
	 *
	 * @param window - the search window
	 * @param template - template projections, one per scale
	 * @param radii - ring radii, the same as for the template projections
	 * @param threshold - survival threshold
	 * @param service - executor for the per-row tasks
	 * @return survivors in scan order, annotated with the best scale
	 */
	public static StageResult filter(
			final Patch window,
			final CircularProjection[] template,
			final int[] radii,
			final Threshold threshold,
			final ExecutorService service )
	{
		final int rMax = radii[ radii.length - 1 ];
		final int minX = rMax, maxX = window.getWidth() - 1 - rMax;
		final int minY = rMax, maxY = window.getHeight() - 1 - rMax;

		final ArrayList< Callable< List< Candidate > > > tasks = new ArrayList<>();

		for ( int y = minY; y <= maxY; ++y )
		{
			final int row = y;

			tasks.add( () ->
			{
				final ArrayList< Candidate > scored = new ArrayList<>();

				for ( int x = minX; x <= maxX; ++x )
				{
					final CircularProjection local = CircularProjection.compute( window, x, row, radii, 1.0 );

					double best = Double.NaN;
					int bestScale = -1;

					for ( int s = 0; s < template.length; ++s )
					{
						final double score = template[ s ].correlate( local );

						// ties keep the smaller scale index
						if ( !Double.isNaN( score ) && ( bestScale < 0 || score > best ) )
						{
							best = score;
							bestScale = s;
						}
					}

					if ( bestScale >= 0 )
						scored.add( new Candidate( x, row, bestScale, best ) );
				}

				return scored;
			} );
		}

		final ArrayList< Candidate > scored = new ArrayList<>();

		for ( final List< Candidate > rowResult : Threads.execTasks( tasks, service, "compute circular projections" ) )
			scored.addAll( rowResult );

		final int evaluated = Math.max( 0, maxX - minX + 1 ) * Math.max( 0, maxY - minY + 1 );
		final double cutoff = threshold.resolve( Threshold.scores( scored ) );
		final List< Candidate > survivors = Threshold.filter( scored, cutoff );

		final StageResult result = new StageResult( Stage.CIFI, evaluated, scored, cutoff, survivors );

		LOG.debug( "{}", result );

		return result;
	}
}
