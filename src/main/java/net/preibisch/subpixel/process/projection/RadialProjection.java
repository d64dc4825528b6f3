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

import net.preibisch.subpixel.process.patch.Patch;

/**
 * Mean intensity on angular sectors of concentric rings. Bin (k, j) averages bilinear samples
 * on the arc of radius (radii[k] + 0.5) / scale that spans [j*alpha - alpha/2, j*alpha + alpha/2).
 * Samples outside the patch are skipped, a bin without valid samples is undefined (NaN).
 */
public class RadialProjection
{
	final int numAngles;

	// [radius][angle]
	final double[][] values;

	protected RadialProjection( final double[][] values, final int numAngles )
	{
		this.values = values;
		this.numAngles = numAngles;
	}

	public int numRadii() { return values.length; }
	public int numAngles() { return numAngles; }
	public double get( final int k, final int j ) { return values[ k ][ j ]; }

	public boolean isInformative()
	{
		final double[] flat = new double[ values.length * numAngles ];

		for ( int k = 0; k < values.length; ++k )
			System.arraycopy( values[ k ], 0, flat, k * numAngles, numAngles );

		return Correlation.isInformative( flat );
	}

	/**
	 * Compares this (template) projection to a window projection under the hypothesis that the
	 * window shows the template rotated by rotation*alpha, i.e. template bin (k, j) is compared
	 * to window bin (k, j + rotation).
	 *
	 * @param window - projection over the same radii, with at least numAngles() + rotation angles
	 * @param rotation - index of the rotation hypothesis
	 * @return Pearson correlation, NaN if undefined
	 */
	public double correlate( final RadialProjection window, final int rotation )
	{
		if ( window.numAngles < numAngles + rotation )
			throw new IllegalArgumentException( "Window projection covers " + window.numAngles + " angles, need " + ( numAngles + rotation ) );

		final double[] a = new double[ values.length * numAngles ];
		final double[] b = new double[ a.length ];

		for ( int k = 0, i = 0; k < values.length; ++k )
			for ( int j = 0; j < numAngles; ++j, ++i )
			{
				a[ i ] = values[ k ][ j ];
				b[ i ] = window.values[ k ][ j + rotation ];
			}

		return Correlation.pearson( a, b );
	}

	public static RadialProjection compute(
			final Patch.Sampler sampler,
			final double cx,
			final double cy,
			final int[] radii,
			final double scale,
			final double alpha,
			final int numAngles )
	{
		final double[][] values = new double[ radii.length ][ numAngles ];

		for ( int k = 0; k < radii.length; ++k )
		{
			final double arcRadius = radii[ k ] + 0.5;
			final double rho = arcRadius / scale;
			final int numSamples = Math.max( 1, (int)Math.ceil( arcRadius * alpha ) );

			for ( int j = 0; j < numAngles; ++j )
			{
				final double start = j * alpha - alpha / 2;

				double sum = 0;
				int count = 0;

				for ( int m = 0; m < numSamples; ++m )
				{
					final double phi = start + alpha * ( m + 0.5 ) / numSamples;
					final double v = sampler.sample( cx + rho * Math.cos( phi ), cy + rho * Math.sin( phi ) );

					if ( !Double.isNaN( v ) )
					{
						sum += v;
						++count;
					}
				}

				values[ k ][ j ] = count == 0 ? Double.NaN : sum / count;
			}
		}

		return new RadialProjection( values, numAngles );
	}
}
