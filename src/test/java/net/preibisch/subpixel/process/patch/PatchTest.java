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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import net.imglib2.Cursor;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ShortArray;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

public class PatchTest
{
	@Test
	public void testWrapImgLib2()
	{
		final ArrayImg< UnsignedShortType, ShortArray > img = ArrayImgs.unsignedShorts( 4, 3 );
		final Cursor< UnsignedShortType > c = img.localizingCursor();

		while ( c.hasNext() )
		{
			c.fwd();
			c.get().set( c.getIntPosition( 0 ) + 10 * c.getIntPosition( 1 ) );
		}

		final Patch patch = Patch.wrap( img );

		assertEquals( 4, patch.getWidth() );
		assertEquals( 3, patch.getHeight() );
		assertEquals( 1.5, patch.getCenterX(), 0 );
		assertEquals( 1.0, patch.getCenterY(), 0 );
		assertEquals( 23, patch.get( 3, 2 ), 0 );

		// the copy is independent of the source
		img.firstElement().set( 1000 );
		assertEquals( 0, patch.get( 0, 0 ), 0 );
	}

	@Test
	public void testWrapOffsetInterval()
	{
		final ArrayImg< FloatType, ? > img = ArrayImgs.floats( new float[]{ 0, 1, 2, 3, 4, 5, 6, 7, 8 }, 3, 3 );
		final Patch patch = Patch.wrap( Views.interval( img, new long[]{ 1, 1 }, new long[]{ 2, 2 } ) );

		assertEquals( 2, patch.getWidth() );
		assertEquals( 4, patch.get( 0, 0 ), 0 );
		assertEquals( 8, patch.get( 1, 1 ), 0 );
	}

	@Test
	public void testWrapImageJ()
	{
		final ByteProcessor bp = new ByteProcessor( 5, 2 );
		bp.set( 4, 1, 200 );

		final Patch patch = Patch.wrap( bp );

		assertEquals( 5, patch.getWidth() );
		assertEquals( 2, patch.getHeight() );
		assertEquals( 200, patch.get( 4, 1 ), 0 );

		final FloatProcessor fp = new FloatProcessor( 2, 2, new float[]{ 1, 2, 3, 4 } );
		final Patch fromFloat = Patch.wrap( fp );
		fp.setf( 0, 0, -1 );

		assertEquals( 1, fromFloat.get( 0, 0 ), 0 );
	}

	@Test
	public void testWrapArrayCopies()
	{
		final float[] pixels = new float[]{ 1, 2, 3, 4, 5, 6 };
		final Patch patch = Patch.wrap( pixels, 3, 2 );
		pixels[ 5 ] = 0;

		assertEquals( 6, patch.get( 2, 1 ), 0 );
		assertEquals( 6, patch.getImg().randomAccess().setPositionAndGet( 2, 1 ).get(), 0 );
	}

	@Test
	public void testImgIsACopy()
	{
		final Patch patch = Patch.wrap( new float[]{ 1, 2, 3, 4, 5, 6 }, 3, 2 );

		patch.getImg().randomAccess().setPositionAndGet( 2, 1 ).set( 100 );

		assertEquals( 6, patch.get( 2, 1 ), 0 );
		assertEquals( 6, patch.sampler().sample( 2, 1 ), 0 );
		assertEquals( 6, patch.getImg().randomAccess().setPositionAndGet( 2, 1 ).get(), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testSizeMismatch()
	{
		Patch.wrap( new float[ 5 ], 2, 2 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNot2d()
	{
		Patch.wrap( ArrayImgs.floats( 2, 2, 2 ) );
	}

	@Test
	public void testConstant()
	{
		assertTrue( Patch.wrap( new float[]{ 0.1f, 0.1f, 0.1f, 0.1f }, 2, 2 ).isConstant() );
		assertFalse( Patch.wrap( new float[]{ 0.1f, 0.1f, 0.1f, 0.2f }, 2, 2 ).isConstant() );
	}

	@Test
	public void testBilinearSampling()
	{
		final Patch patch = Patch.wrap( new float[]{ 0, 10, 20, 30 }, 2, 2 );
		final Patch.Sampler sampler = patch.sampler();

		assertEquals( 15.0, sampler.sample( 0.5, 0.5 ), 1e-6 );
		assertEquals( 5.0, sampler.sample( 0.5, 0 ), 1e-6 );
		assertEquals( 30.0, sampler.sample( 1, 1 ), 1e-6 );

		assertTrue( Double.isNaN( sampler.sample( -0.01, 0 ) ) );
		assertTrue( Double.isNaN( sampler.sample( 0, 1.01 ) ) );
	}
}
