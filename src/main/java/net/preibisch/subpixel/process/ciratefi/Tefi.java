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
import net.preibisch.subpixel.process.projection.Correlation;

/**
 * Template matching filter: normalized cross-correlation of the rotated and scaled template
 * against the window at every RAFI survivor, selection of the best candidate and subpixel
 * localization of its correlation peak.
 *
 * The correlation support are all template pixels u with scale * |u| &lt; maxRadius + 1, i.e.
 * the disc that the circular projection covers. Template pixel u is compared to the window
 * sampled bilinearly at position + scale * R(rotation) * u.
 */
public class Tefi
{
	private static final Logger LOG = LoggerFactory.getLogger( Tefi.class );

	public static StageResult filter(
			final Patch template,
			final Patch window,
			final List< Candidate > candidates,
			final double[] scales,
			final AngleSet angles,
			final int maxRadius,
			final Threshold threshold,
			final ExecutorService service )
	{
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
					final TransformedTemplate t = new TransformedTemplate(
							template, scales[ c.getScaleIndex() ], angles.angle( c.getRotationIndex() ), maxRadius );

					final double score = t.correlate( sampler, c.getX(), c.getY() );

					if ( !Double.isNaN( score ) )
						scored.add( c.withScore( score ) );
				}

				return scored;
			} );
		}

		final ArrayList< Candidate > scored = new ArrayList<>();

		for ( final List< Candidate > partial : Threads.execTasks( tasks, service, "correlate template" ) )
			scored.addAll( partial );

		final double cutoff = threshold.resolve( Threshold.scores( scored ) );
		final List< Candidate > survivors = Threshold.filter( scored, cutoff );

		final StageResult result = new StageResult( Stage.TEFI, candidates.size(), scored, cutoff, survivors );

		LOG.debug( "{}", result );

		return result;
	}

	/**
	 * Highest score wins; ties are broken by the distance to the window center, then the
	 * rotation, then the scale, then the scan order.
	 *
	 * @param candidates - TEFI survivors, not empty
	 * @param window - the search window
	 * @return the best candidate
	 */
	public static Candidate selectBest( final List< Candidate > candidates, final Patch window )
	{
		Candidate best = null;

		for ( final Candidate c : candidates )
			if ( best == null || compare( c, best, window ) < 0 )
				best = c;

		return best;
	}

	protected static int compare( final Candidate a, final Candidate b, final Patch window )
	{
		int cmp = Double.compare( b.getScore(), a.getScore() );

		if ( cmp != 0 )
			return cmp;

		cmp = Double.compare( distanceToCenterSq( a, window ), distanceToCenterSq( b, window ) );

		if ( cmp != 0 )
			return cmp;

		cmp = Integer.compare( a.getRotationIndex(), b.getRotationIndex() );

		if ( cmp != 0 )
			return cmp;

		cmp = Integer.compare( a.getScaleIndex(), b.getScaleIndex() );

		if ( cmp != 0 )
			return cmp;

		cmp = Integer.compare( a.getY(), b.getY() );

		return cmp != 0 ? cmp : Integer.compare( a.getX(), b.getX() );
	}

	protected static double distanceToCenterSq( final Candidate c, final Patch window )
	{
		final double dx = c.getX() - window.getCenterX();
		final double dy = c.getY() - window.getCenterY();

		return dx * dx + dy * dy;
	}

	/**
	 * Evaluates the correlation on the offset grid (i/upsampling, j/upsampling) with
	 * -upsampling &lt;= i, j &lt;= upsampling around the candidate, which equals correlating
	 * against the bilinearly upsampled window, and refines the grid maximum with a parabola
	 * through its neighbors along each axis.
	 *
	 * @param template - the template
	 * @param window - the search window
	 * @param best - the selected candidate
	 * @param scales - scale hypotheses
	 * @param angles - rotation hypotheses
	 * @param maxRadius - largest ring radius
	 * @param upsampling - grid steps per pixel
	 * @return { x, y, score } of the peak in window pixel coordinates
	 */
	public static double[] localize(
			final Patch template,
			final Patch window,
			final Candidate best,
			final double[] scales,
			final AngleSet angles,
			final int maxRadius,
			final int upsampling )
	{
		final TransformedTemplate t = new TransformedTemplate(
				template, scales[ best.getScaleIndex() ], angles.angle( best.getRotationIndex() ), maxRadius );
		final Patch.Sampler sampler = window.sampler();

		final int size = 2 * upsampling + 1;
		final double[][] grid = new double[ size ][ size ];

		for ( int j = 0; j < size; ++j )
			for ( int i = 0; i < size; ++i )
				grid[ j ][ i ] = ( i == upsampling && j == upsampling ) ?
						best.getScore() :
						t.correlate( sampler, best.getX() + (double)( i - upsampling ) / upsampling, best.getY() + (double)( j - upsampling ) / upsampling );

		int bi = upsampling, bj = upsampling;

		for ( int j = 0; j < size; ++j )
			for ( int i = 0; i < size; ++i )
			{
				if ( Double.isNaN( grid[ j ][ i ] ) )
					continue;

				final double current = grid[ bj ][ bi ];

				// ties keep the offset closer to the integer position
				if ( grid[ j ][ i ] > current ||
					( grid[ j ][ i ] == current && sq( i - upsampling ) + sq( j - upsampling ) < sq( bi - upsampling ) + sq( bj - upsampling ) ) )
				{
					bi = i;
					bj = j;
				}
			}

		double offsetX = bi - upsampling;
		double offsetY = bj - upsampling;

		if ( bi > 0 && bi < size - 1 )
			offsetX += parabolicPeak( grid[ bj ][ bi - 1 ], grid[ bj ][ bi ], grid[ bj ][ bi + 1 ] );

		if ( bj > 0 && bj < size - 1 )
			offsetY += parabolicPeak( grid[ bj - 1 ][ bi ], grid[ bj ][ bi ], grid[ bj + 1 ][ bi ] );

		return new double[]{
				best.getX() + offsetX / upsampling,
				best.getY() + offsetY / upsampling,
				grid[ bj ][ bi ] };
	}

	/**
	 * @param left - value at -1
	 * @param center - value at 0, the discrete maximum
	 * @param right - value at +1
	 * @return vertex of the parabola through the three values, within [-0.5, 0.5]; 0 if undefined
	 */
	public static double parabolicPeak( final double left, final double center, final double right )
	{
		if ( Double.isNaN( left ) || Double.isNaN( right ) )
			return 0;

		final double curvature = left - 2 * center + right;

		if ( curvature >= 0 )
			return 0;

		return Math.max( -0.5, Math.min( 0.5, 0.5 * ( left - right ) / curvature ) );
	}

	private static int sq( final int v ) { return v * v; }

	/**
	 * The template pixels of the correlation support together with their offsets in window
	 * coordinates for one scale and rotation.
	 */
	public static class TransformedTemplate
	{
		final double[] offsetX, offsetY, values;

		public TransformedTemplate( final Patch template, final double scale, final double rotation, final int maxRadius )
		{
			final double cx = template.getCenterX();
			final double cy = template.getCenterY();
			final double cos = Math.cos( rotation ) * scale;
			final double sin = Math.sin( rotation ) * scale;

			final ArrayList< double[] > support = new ArrayList<>();

			for ( int y = 0; y < template.getHeight(); ++y )
				for ( int x = 0; x < template.getWidth(); ++x )
				{
					final double ux = x - cx;
					final double uy = y - cy;

					if ( scale * Math.sqrt( ux * ux + uy * uy ) < maxRadius + 1 )
						support.add( new double[]{ cos * ux - sin * uy, sin * ux + cos * uy, template.get( x, y ) } );
				}

			this.offsetX = new double[ support.size() ];
			this.offsetY = new double[ support.size() ];
			this.values = new double[ support.size() ];

			for ( int i = 0; i < support.size(); ++i )
			{
				offsetX[ i ] = support.get( i )[ 0 ];
				offsetY[ i ] = support.get( i )[ 1 ];
				values[ i ] = support.get( i )[ 2 ];
			}
		}

		public int size() { return values.length; }

		/**
		 * @param sampler - sampler of the window
		 * @param x - position of the template center in the window
		 * @param y - position of the template center in the window
		 * @return Pearson correlation, NaN if less than half of the support falls into the window
		 */
		public double correlate( final Patch.Sampler sampler, final double x, final double y )
		{
			final double[] samples = new double[ values.length ];
			int valid = 0;

			for ( int i = 0; i < values.length; ++i )
			{
				samples[ i ] = sampler.sample( x + offsetX[ i ], y + offsetY[ i ] );

				if ( !Double.isNaN( samples[ i ] ) )
					++valid;
			}

			if ( 2 * valid < values.length )
				return Double.NaN;

			return Correlation.pearson( values, samples );
		}
	}
}
