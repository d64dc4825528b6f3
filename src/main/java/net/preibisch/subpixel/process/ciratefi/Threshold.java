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

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Score cutoff of a funnel stage, either an absolute correlation value in [-1, 1] or the share
 * in (0, 100] of the defined scores of the stage to keep. Percentile(30) keeps the best 30%,
 * Percentile(100) keeps everything.
 */
public abstract class Threshold
{
	public static Threshold absolute( final double value ) { return new AbsoluteThreshold( value ); }
	public static Threshold percentile( final double percentile ) { return new PercentileThreshold( percentile ); }

	public abstract boolean isPercentile();
	public abstract double getValue();
	public abstract boolean isValid();

	/**
	 * @param scores - the scores of all candidates of a stage, NaN entries are ignored
	 * @return the absolute cutoff, NaN if no score is defined
	 */
	public abstract double resolve( final double[] scores );

	/**
	 * Resolves the cutoff over the candidates' scores and keeps those that reach it, in their
	 * original order.
	 *
	 * @param candidates - scored candidates
	 * @return the survivors
	 */
	public List< Candidate > filter( final List< Candidate > candidates )
	{
		return filter( candidates, resolve( scores( candidates ) ) );
	}

	public static List< Candidate > filter( final List< Candidate > candidates, final double cutoff )
	{
		final ArrayList< Candidate > survivors = new ArrayList<>();

		if ( Double.isNaN( cutoff ) )
			return survivors;

		for ( final Candidate c : candidates )
			if ( c.getScore() >= cutoff )
				survivors.add( c );

		return survivors;
	}

	public static double[] scores( final List< Candidate > candidates )
	{
		final double[] scores = new double[ candidates.size() ];

		for ( int i = 0; i < scores.length; ++i )
			scores[ i ] = candidates.get( i ).getScore();

		return scores;
	}

	protected static double[] defined( final double[] scores )
	{
		int n = 0;

		for ( final double s : scores )
			if ( !Double.isNaN( s ) )
				++n;

		final double[] defined = new double[ n ];

		for ( int i = 0, j = 0; i < scores.length; ++i )
			if ( !Double.isNaN( scores[ i ] ) )
				defined[ j++ ] = scores[ i ];

		return defined;
	}

	public static class AbsoluteThreshold extends Threshold
	{
		final double value;

		public AbsoluteThreshold( final double value ) { this.value = value; }

		@Override
		public boolean isPercentile() { return false; }

		@Override
		public double getValue() { return value; }

		@Override
		public boolean isValid() { return value >= -1 && value <= 1; }

		@Override
		public double resolve( final double[] scores )
		{
			return defined( scores ).length == 0 ? Double.NaN : value;
		}

		@Override
		public String toString() { return "Absolute(" + value + ")"; }
	}

	public static class PercentileThreshold extends Threshold
	{
		final double percentile;

		public PercentileThreshold( final double percentile ) { this.percentile = percentile; }

		@Override
		public boolean isPercentile() { return true; }

		@Override
		public double getValue() { return percentile; }

		@Override
		public boolean isValid() { return percentile > 0 && percentile <= 100; }

		/**
		 * The cutoff is the (100 - percentile)-th percentile of the defined scores, so that the
		 * requested share of candidates reaches it.
		 */
		@Override
		public double resolve( final double[] scores )
		{
			final double[] defined = defined( scores );

			if ( defined.length == 0 )
				return Double.NaN;

			final double rank = 100 - percentile;

			if ( rank <= 0 )
			{
				double min = defined[ 0 ];

				for ( final double s : defined )
					min = Math.min( min, s );

				return min;
			}

			// linear interpolation between closest ranks, as numpy's default
			return new Percentile().withEstimationType( EstimationType.R_7 ).evaluate( defined, rank );
		}

		@Override
		public String toString() { return "Percentile(" + percentile + ")"; }
	}
}
