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
package net.preibisch.subpixel.process;

import java.util.Arrays;
import java.util.Random;

import net.preibisch.subpixel.process.patch.Patch;

/**
 * Analytic test images: a sum of anisotropically placed gaussian blobs on a constant
 * background, sampled exactly at every pixel so that shifted and rotated versions need no
 * interpolation.
 */
public class SyntheticPatches
{
	// x, y, sigma, amplitude
	static final double[][] blobs = new double[][]{
		{ -5, -3, 2.5, 100 },
		{ 4, -6, 3.0, 60 },
		{ 6, 5, 2.0, 80 },
		{ -3, 7, 3.5, 40 },
		{ 1, 1, 1.5, 50 },
		{ -14, 12, 3.0, 70 },
		{ 13, -12, 3.0, 90 },
		{ 15, 14, 2.5, 50 },
		{ -12, -15, 3.0, 65 },
		{ -16, 0, 2.5, 45 },
		{ 0, 16, 3.0, 55 },
		{ 16, -2, 2.0, 75 },
		{ 2, -16, 3.0, 35 }
	};

	public static double intensity( final double x, final double y )
	{
		double value = 10;

		for ( final double[] b : blobs )
		{
			final double dx = x - b[ 0 ];
			final double dy = y - b[ 1 ];
			value += b[ 3 ] * Math.exp( -( dx * dx + dy * dy ) / ( 2 * b[ 2 ] * b[ 2 ] ) );
		}

		return value;
	}

	public static Patch create( final int width, final int height, final double shiftX, final double shiftY, final double rotation )
	{
		return create( width, height, shiftX, shiftY, rotation, 1.0 );
	}

	/**
	 * Pixel p shows intensity( R(-rotation) * (p - center - shift) / scale ), i.e. the pattern
	 * enlarged by scale, rotated by rotation and moved by shift relative to the patch center.
	 *
	 * @param width - patch width
	 * @param height - patch height
	 * @param shiftX - displacement of the pattern origin from the patch center
	 * @param shiftY - displacement of the pattern origin from the patch center
	 * @param rotation - rotation of the pattern in radians
	 * @param scale - magnification of the pattern
	 * @return the patch
	 */
	public static Patch create( final int width, final int height, final double shiftX, final double shiftY, final double rotation, final double scale )
	{
		final float[] pixels = new float[ width * height ];
		final double cx = ( width - 1 ) / 2.0;
		final double cy = ( height - 1 ) / 2.0;
		final double cos = Math.cos( rotation );
		final double sin = Math.sin( rotation );

		for ( int y = 0; y < height; ++y )
			for ( int x = 0; x < width; ++x )
			{
				final double ux = x - cx - shiftX;
				final double uy = y - cy - shiftY;

				pixels[ y * width + x ] = (float)intensity( ( cos * ux + sin * uy ) / scale, ( -sin * ux + cos * uy ) / scale );
			}

		return Patch.wrap( pixels, width, height );
	}

	public static Patch template() { return create( 21, 21, 0, 0, 0 ); }

	public static Patch constant( final int width, final int height, final float value )
	{
		final float[] pixels = new float[ width * height ];
		Arrays.fill( pixels, value );

		return Patch.wrap( pixels, width, height );
	}

	public static Patch noise( final int width, final int height, final long seed )
	{
		final Random rnd = new Random( seed );
		final float[] pixels = new float[ width * height ];

		for ( int i = 0; i < pixels.length; ++i )
			pixels[ i ] = 100 * rnd.nextFloat();

		return Patch.wrap( pixels, width, height );
	}

	public static double angularDistance( final double a, final double b )
	{
		final double d = Math.abs( a - b ) % ( 2 * Math.PI );

		return Math.min( d, 2 * Math.PI - d );
	}
}
