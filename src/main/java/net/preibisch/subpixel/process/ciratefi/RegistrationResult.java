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

import java.util.Arrays;

/**
 * Outcome of a registration. On success the offset (dx, dy) is the position of the template
 * center in the window relative to the window center, in window pixels; the rotation in [0, 2pi)
 * is the angle by which the template appears rotated in the window; the score is the Pearson
 * correlation in [-1, 1].
 *
 * If the funnel ran empty, the failing stage and the reason are reported and all numeric values
 * are NaN. In both cases the number of survivors per stage is available, stages that did not run
 * report -1.
 */
public class RegistrationResult
{
	final boolean success;
	final double dx, dy, rotation, scale, score;
	final Stage failedStage;
	final String reason;
	final int evaluated;
	final int[] survivors;

	protected RegistrationResult(
			final boolean success,
			final double dx,
			final double dy,
			final double rotation,
			final double scale,
			final double score,
			final Stage failedStage,
			final String reason,
			final int evaluated,
			final int[] survivors )
	{
		this.success = success;
		this.dx = dx;
		this.dy = dy;
		this.rotation = rotation;
		this.scale = scale;
		this.score = score;
		this.failedStage = failedStage;
		this.reason = reason;
		this.evaluated = evaluated;
		this.survivors = survivors.clone();
	}

	public static RegistrationResult success(
			final double dx,
			final double dy,
			final double rotation,
			final double scale,
			final double score,
			final int evaluated,
			final int[] survivors )
	{
		return new RegistrationResult( true, dx, dy, rotation, scale, score, null, "", evaluated, survivors );
	}

	public static RegistrationResult failed(
			final Stage stage,
			final String reason,
			final int evaluated,
			final int[] survivors )
	{
		return new RegistrationResult( false, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, stage, reason, evaluated, survivors );
	}

	public boolean isSuccess() { return success; }
	public double getDx() { return dx; }
	public double getDy() { return dy; }
	public double[] getOffset() { return new double[]{ dx, dy }; }
	public double getRotation() { return rotation; }
	public double getScale() { return scale; }
	public double getScore() { return score; }

	/**
	 * @return the stage whose survivor set was empty, null on success
	 */
	public Stage getFailedStage() { return failedStage; }
	public String getReason() { return reason; }

	/**
	 * @return number of window positions screened by CIFI
	 */
	public int getNumEvaluated() { return evaluated; }
	public int getNumSurvivors( final Stage stage ) { return survivors[ stage.ordinal() ]; }

	@Override
	public String toString()
	{
		if ( success )
			return "Registered: dx=" + dx + ", dy=" + dy + ", rotation=" + rotation + ", scale=" + scale +
					", score=" + score + ", survivors " + Arrays.toString( survivors ) + " of " + evaluated;
		else
			return "No match, " + failedStage.name() + " exhausted: " + reason + ", survivors " +
					Arrays.toString( survivors ) + " of " + evaluated;
	}
}
