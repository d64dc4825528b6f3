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

import java.util.Arrays;

import net.preibisch.subpixel.process.patch.Patch;

/**
 * Mean intensity on concentric rings around a center. Ring k holds all pixels p with
 * radii[k] &lt;= scale * |p - center| &lt; radii[k] + 1. Pixels outside the patch do not
 * contribute, a ring without any pixel inside the patch is undefined (NaN).
 */
public class CircularProjection
{
	final int[] radii;
	final double[] values;

	protected CircularProjection( final int[] radii, final double[] values )
	{
		this.radii = radii;
		this.values = values;
	}

	public int size() { return values.length; }
	public int getRadius( final int k ) { return radii[ k ]; }
	public double get( final int k ) { return values[ k ]; }
	public double[] getValues() { return values.clone(); }

	public boolean isInformative() { return Correlation.isInformative( values ); }

	/**
	 * @param other - projection over the same radii
	 * @return Pearson correlation over the rings defined in both, NaN if undefined
	 */
	public double correlate( final CircularProjection other )
	{
		return Correlation.pearson( values, other.values );
	}

	public static CircularProjection compute(
			final Patch patch,
			final double cx,
			final double cy,
			final int[] radii,
			final double scale )
	{
		final int rMax = radii[ radii.length - 1 ];

		// ring index for every integer distance, -1 if not part of the set
		final int[] ringOf = new int[ rMax + 1 ];
		Arrays.fill( ringOf, -1 );

		for ( int k = 0; k < radii.length; ++k )
			ringOf[ radii[ k ] ] = k;

		final double[] sum = new double[ radii.length ];
		final int[] count = new int[ radii.length ];

		final double reach = ( rMax + 1 ) / scale;

		final int minX = Math.max( 0, (int)Math.floor( cx - reach ) );
		final int maxX = Math.min( patch.getWidth() - 1, (int)Math.ceil( cx + reach ) );
		final int minY = Math.max( 0, (int)Math.floor( cy - reach ) );
		final int maxY = Math.min( patch.getHeight() - 1, (int)Math.ceil( cy + reach ) );

		for ( int y = minY; y <= maxY; ++y )
		{
			final double dy = y - cy;

			for ( int x = minX; x <= maxX; ++x )
			{
				final double dx = x - cx;
				final double d = scale * Math.sqrt( dx * dx + dy * dy );

				if ( d >= rMax + 1 )
					continue;

				final int k = ringOf[ (int)d ];

				if ( k >= 0 )
				{
					sum[ k ] += patch.get( x, y );
					++count[ k ];
				}
			}
		}

		final double[] values = new double[ radii.length ];

		for ( int k = 0; k < radii.length; ++k )
			values[ k ] = count[ k ] == 0 ? Double.NaN : sum[ k ] / count[ k ];

		return new CircularProjection( radii.clone(), values );
	}

	@Override
	public String toString() { return "CircularProjection" + Arrays.toString( values ); }
}
