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

public class RadialProjectionTest
{
	@Test
	public void testRampSectors()
	{
		final int size = 11;
		final float[] pixels = new float[ size * size ];

		for ( int y = 0; y < size; ++y )
			for ( int x = 0; x < size; ++x )
				pixels[ y * size + x ] = x;

		final Patch ramp = Patch.wrap( pixels, size, size );
		final RadialProjection p = RadialProjection.compute( ramp.sampler(), 5, 5, new int[]{ 2 }, 1.0, Math.PI / 2, 4 );

		assertEquals( 1, p.numRadii() );
		assertEquals( 4, p.numAngles() );

		assertTrue( p.get( 0, 0 ) > 5 );
		assertTrue( p.get( 0, 2 ) < 5 );
		assertEquals( 5.0, p.get( 0, 1 ), 1e-6 );
		assertEquals( 5.0, p.get( 0, 3 ), 1e-6 );
		assertTrue( p.isInformative() );
	}

	@Test
	public void testSectorOutsidePatchIsUndefined()
	{
		final Patch patch = SyntheticPatches.template();
		final RadialProjection p = RadialProjection.compute( patch.sampler(), 1, 1, new int[]{ 5 }, 1.0, Math.PI / 2, 4 );

		// pointing right stays inside, pointing left leaves the patch
		assertFalse( Double.isNaN( p.get( 0, 0 ) ) );
		assertTrue( Double.isNaN( p.get( 0, 2 ) ) );
	}

	@Test
	public void testRotationIsAnAngleShift()
	{
		final AngleSet angles = new AngleSet( Math.PI / 16 );
		final int[] radii = new int[]{ 2, 3, 4, 5, 6, 7, 8, 9, 10 };
		final int rotation = 4;

		final Patch template = SyntheticPatches.template();
		final Patch window = SyntheticPatches.create( 31, 31, 0, 0, angles.angle( rotation ) );

		final RadialProjection t = RadialProjection.compute(
				template.sampler(), template.getCenterX(), template.getCenterY(), radii, 1.0, angles.getAlpha(), angles.size() );
		final RadialProjection w = RadialProjection.compute(
				window.sampler(), window.getCenterX(), window.getCenterY(), radii, 1.0, angles.getAlpha(), 2 * angles.size() - 1 );

		int best = -1;
		double bestScore = Double.NEGATIVE_INFINITY;

		for ( int q = 0; q < angles.size(); ++q )
		{
			final double score = t.correlate( w, q );

			if ( score > bestScore )
			{
				bestScore = score;
				best = q;
			}
		}

		assertEquals( rotation, best );
		assertTrue( bestScore > 0.95 );
		assertTrue( t.correlate( w, 0 ) < bestScore );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testWindowNeedsEnoughAngles()
	{
		final Patch template = SyntheticPatches.template();
		final RadialProjection t = RadialProjection.compute( template.sampler(), 10, 10, new int[]{ 3 }, 1.0, Math.PI / 2, 4 );

		t.correlate( t, 1 );
	}
}
