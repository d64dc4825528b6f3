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

/**
 * An integer window position, optionally with the best scale and rotation found so far, and the
 * score of the stage that produced it. Immutable, stages create new instances.
 */
public class Candidate
{
	public static final int NO_ROTATION = -1;

	final int x, y, scaleIndex, rotationIndex;
	final double score;

	public Candidate( final int x, final int y, final int scaleIndex, final int rotationIndex, final double score )
	{
		this.x = x;
		this.y = y;
		this.scaleIndex = scaleIndex;
		this.rotationIndex = rotationIndex;
		this.score = score;
	}

	public Candidate( final int x, final int y, final int scaleIndex, final double score )
	{
		this( x, y, scaleIndex, NO_ROTATION, score );
	}

	public int getX() { return x; }
	public int getY() { return y; }
	public int getScaleIndex() { return scaleIndex; }
	public int getRotationIndex() { return rotationIndex; }
	public boolean hasRotation() { return rotationIndex != NO_ROTATION; }
	public double getScore() { return score; }

	public Candidate withRotation( final int rotationIndex, final double score )
	{
		return new Candidate( x, y, scaleIndex, rotationIndex, score );
	}

	public Candidate withScore( final double score )
	{
		return new Candidate( x, y, scaleIndex, rotationIndex, score );
	}

	@Override
	public String toString()
	{
		return "Candidate[x=" + x + ", y=" + y + ", scale=" + scaleIndex + ", rotation=" + rotationIndex + ", score=" + score + "]";
	}
}
