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
package net.preibisch.subpixel.process.projection;

import net.imglib2.util.RealSum;

/**
 * Pearson correlation as the similarity metric of all stages, range [-1, 1].
 * Pairs where either side is undefined (NaN) are skipped. With fewer than two usable
 * pairs, or if either side is constant, the correlation is undefined and NaN is returned.
 */
public class Correlation
{
	public static double pearson( final double[] a, final double[] b )
	{
		return pearson( a, b, a.length );
	}

	/**
	 * @param a - first vector
	 * @param b - second vector
	 * @param length - number of leading entries to use
	 * @return the correlation or NaN if it is undefined
	 */
	public static double pearson( final double[] a, final double[] b, final int length )
	{
		if ( a.length < length || b.length < length )
			throw new IllegalArgumentException( "Vectors shorter than " + length + ": " + a.length + ", " + b.length );

		final RealSum sumA = new RealSum();
		final RealSum sumB = new RealSum();

		int n = 0;
		boolean constantA = true, constantB = true;
		double firstA = Double.NaN, firstB = Double.NaN;

		for ( int i = 0; i < length; ++i )
		{
			if ( Double.isNaN( a[ i ] ) || Double.isNaN( b[ i ] ) )
				continue;

			if ( n == 0 )
			{
				firstA = a[ i ];
				firstB = b[ i ];
			}
			else
			{
				constantA &= a[ i ] == firstA;
				constantB &= b[ i ] == firstB;
			}

			sumA.add( a[ i ] );
			sumB.add( b[ i ] );
			++n;
		}

		if ( n < 2 || constantA || constantB )
			return Double.NaN;

		final double meanA = sumA.getSum() / n;
		final double meanB = sumB.getSum() / n;

		final RealSum sAB = new RealSum();
		final RealSum sAA = new RealSum();
		final RealSum sBB = new RealSum();

		for ( int i = 0; i < length; ++i )
		{
			if ( Double.isNaN( a[ i ] ) || Double.isNaN( b[ i ] ) )
				continue;

			final double da = a[ i ] - meanA;
			final double db = b[ i ] - meanB;

			sAB.add( da * db );
			sAA.add( da * da );
			sBB.add( db * db );
		}

		final double denom = Math.sqrt( sAA.getSum() * sBB.getSum() );

		if ( denom == 0 )
			return Double.NaN;

		return Math.max( -1.0, Math.min( 1.0, sAB.getSum() / denom ) );
	}

	/**
	 * @param values - a profile, may contain NaN
	 * @return true if at least two entries are defined and they are not all identical
	 */
	public static boolean isInformative( final double[] values )
	{
		double first = Double.NaN;

		for ( final double v : values )
		{
			if ( Double.isNaN( v ) )
				continue;

			if ( Double.isNaN( first ) )
				first = v;
			else if ( v != first )
				return true;
		}

		return false;
	}
}
