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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.preibisch.subpixel.process.SyntheticPatches;
import net.preibisch.subpixel.process.patch.Patch;

public class CircularProjectionTest
{
	/**
	 * @return patch whose intensity is the integer part of the distance to the center
	 */
	private static Patch distanceRings( final int size )
	{
		final float[] pixels = new float[ size * size ];
		final double c = ( size - 1 ) / 2.0;

		for ( int y = 0; y < size; ++y )
			for ( int x = 0; x < size; ++x )
				pixels[ y * size + x ] = (float)Math.floor( Math.sqrt( ( x - c ) * ( x - c ) + ( y - c ) * ( y - c ) ) );

		return Patch.wrap( pixels, size, size );
	}

	@Test
	public void testRingMeans()
	{
		final Patch patch = distanceRings( 21 );
		final int[] radii = new int[]{ 1, 2, 3, 5, 8, 10 };

		final CircularProjection p = CircularProjection.compute( patch, 10, 10, radii, 1.0 );

		assertEquals( radii.length, p.size() );

		for ( int k = 0; k < radii.length; ++k )
		{
			assertEquals( radii[ k ], p.getRadius( k ) );
			assertEquals( radii[ k ], p.get( k ), 1e-9 );
		}

		assertTrue( p.isInformative() );
	}

	@Test
	public void testScale()
	{
		final Patch patch = distanceRings( 21 );
		final int[] radii = new int[]{ 1, 2, 3, 4 };

		// at scale 0.5 ring r covers distances [2r, 2r+2)
		final CircularProjection p = CircularProjection.compute( patch, 10, 10, radii, 0.5 );

		for ( int k = 0; k < radii.length; ++k )
		{
			assertTrue( p.get( k ) >= 2 * radii[ k ] );
			assertTrue( p.get( k ) <= 2 * radii[ k ] + 1 );
		}
	}

	@Test
	public void testRingOutsidePatchIsUndefined()
	{
		final Patch patch = distanceRings( 5 );

		final CircularProjection p = CircularProjection.compute( patch, 2, 2, new int[]{ 1, 2, 5 }, 1.0 );

		assertEquals( 1.0, p.get( 0 ), 1e-9 );
		assertEquals( 2.0, p.get( 1 ), 1e-9 );
		assertTrue( Double.isNaN( p.get( 2 ) ) );
	}

	@Test
	public void testOutsidePixelsAreExcluded()
	{
		final Patch patch = distanceRings( 21 );

		// at the corner only a quarter of each ring lies inside, the mean must not be pulled towards zero
		final CircularProjection corner = CircularProjection.compute( patch, 0, 0, new int[]{ 3 }, 1.0 );
		final Patch constant = SyntheticPatches.constant( 21, 21, 7 );
		final CircularProjection constantCorner = CircularProjection.compute( constant, 0, 0, new int[]{ 3, 4 }, 1.0 );

		assertFalse( Double.isNaN( corner.get( 0 ) ) );
		assertEquals( 7.0, constantCorner.get( 0 ), 0 );
		assertEquals( 7.0, constantCorner.get( 1 ), 0 );
		assertFalse( constantCorner.isInformative() );
	}

	@Test
	public void testIdenticalNeighborhoodsCorrelatePerfectly()
	{
		final Patch template = SyntheticPatches.template();
		final Patch window = SyntheticPatches.create( 41, 41, 0, 0, 0 );
		final int[] radii = new int[]{ 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };

		final CircularProjection t = CircularProjection.compute( template, 10, 10, radii, 1.0 );
		final CircularProjection w = CircularProjection.compute( window, 20, 20, radii, 1.0 );
		final CircularProjection off = CircularProjection.compute( window, 14, 25, radii, 1.0 );

		assertEquals( 1.0, t.correlate( w ), 1e-9 );
		assertTrue( t.correlate( off ) < t.correlate( w ) );
	}
}
