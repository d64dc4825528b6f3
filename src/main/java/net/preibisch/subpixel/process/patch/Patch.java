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
package net.preibisch.subpixel.process.patch;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.RealRandomAccessible;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * An immutable 2d grid of intensities. The reference point is the center of the grid,
 * ((width-1)/2, (height-1)/2). All data is copied on creation, callers may keep modifying
 * their own buffers.
 */
public class Patch
{
	final int width, height;
	final float[] pixels;
	final ArrayImg< FloatType, FloatArray > img;

	protected Patch( final float[] pixels, final int width, final int height )
	{
		if ( width < 1 || height < 1 )
			throw new IllegalArgumentException( "Patch must not be empty: " + width + "x" + height );

		if ( pixels.length != width * height )
			throw new IllegalArgumentException( "Pixel array length " + pixels.length + " does not match " + width + "x" + height );

		this.width = width;
		this.height = height;
		this.pixels = pixels;
		this.img = ArrayImgs.floats( pixels, width, height );
	}

	public static Patch wrap( final float[] pixels, final int width, final int height )
	{
		return new Patch( pixels.clone(), width, height );
	}

	public static Patch wrap( final ImageProcessor ip )
	{
		final FloatProcessor fp = ip.convertToFloatProcessor();
		return new Patch( ( (float[])fp.getPixels() ).clone(), fp.getWidth(), fp.getHeight() );
	}

	public static < T extends RealType< T > > Patch wrap( final RandomAccessibleInterval< T > interval )
	{
		if ( interval.numDimensions() != 2 )
			throw new IllegalArgumentException( "Only 2d patches are supported, got " + interval.numDimensions() + " dimensions." );

		final int width = (int)interval.dimension( 0 );
		final int height = (int)interval.dimension( 1 );
		final float[] pixels = new float[ width * height ];

		final Cursor< T > cursor = Views.flatIterable( interval ).cursor();

		for ( int i = 0; cursor.hasNext(); ++i )
			pixels[ i ] = cursor.next().getRealFloat();

		return new Patch( pixels, width, height );
	}

	public int getWidth() { return width; }
	public int getHeight() { return height; }
	public double getCenterX() { return ( width - 1 ) / 2.0; }
	public double getCenterY() { return ( height - 1 ) / 2.0; }

	public float get( final int x, final int y ) { return pixels[ y * width + x ]; }

	/**
	 * @return a copy of the intensities as imglib2 image, writing to it does not change the patch
	 */
	public RandomAccessibleInterval< FloatType > getImg() { return ArrayImgs.floats( pixels.clone(), width, height ); }

	/**
	 * @return true if all intensities are identical, i.e. the patch has zero variance
	 */
	public boolean isConstant()
	{
		for ( final float v : pixels )
			if ( v != pixels[ 0 ] )
				return false;

		return true;
	}

	/**
	 * @return a new bilinear sampler, not thread safe; create one per thread
	 */
	public Sampler sampler() { return new Sampler(); }

	/**
	 * Bilinear sampling inside [0, width-1] x [0, height-1]; everything outside is undefined (NaN).
	 */
	public class Sampler
	{
		final RealRandomAccess< FloatType > access;

		Sampler()
		{
			final RealRandomAccessible< FloatType > interpolated =
					Views.interpolate( Views.extendBorder( img ), new NLinearInterpolatorFactory< FloatType >() );

			this.access = interpolated.realRandomAccess();
		}

		public double sample( final double x, final double y )
		{
			if ( x < 0 || y < 0 || x > width - 1 || y > height - 1 )
				return Double.NaN;

			access.setPosition( x, 0 );
			access.setPosition( y, 1 );

			return access.get().getRealDouble();
		}
	}
}
