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

/**
 * The discrete rotation hypotheses {0, alpha, 2*alpha, ...} covering [0, 2pi).
 */
public class AngleSet
{
	// the window side of the radial comparison samples 2 * size - 1 angles per ring
	public static final int MAX_SIZE = 1 << 16;

	final double alpha;
	final int size;

	public AngleSet( final double alpha )
	{
		if ( !( alpha > 0 && alpha < 2 * Math.PI ) )
			throw new IllegalArgumentException( "Angular step must be in (0, 2pi), but is " + alpha );

		final double size = size( alpha );

		if ( size > MAX_SIZE )
			throw new IllegalArgumentException( "Angular step " + alpha + " yields " + size + " rotations, at most " + MAX_SIZE + " are supported" );

		this.alpha = alpha;
		this.size = (int)size;
	}

	/**
	 * @param alpha - angular step in (0, 2pi)
	 * @return number of rotation hypotheses, as double so that tiny steps do not overflow
	 */
	public static double size( final double alpha )
	{
		// tolerate rounding for steps that divide 2pi evenly
		return Math.ceil( 2 * Math.PI / alpha - 1e-9 );
	}

	public double getAlpha() { return alpha; }
	public int size() { return size; }
	public double angle( final int index ) { return index * alpha; }

	@Override
	public String toString() { return "AngleSet[alpha=" + alpha + ", size=" + size + "]"; }
}
