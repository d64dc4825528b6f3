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

import net.preibisch.subpixel.process.patch.Patch;
import net.preibisch.subpixel.process.projection.AngleSet;

/**
 * Configuration of a CIRATEFI registration. All values are checked by {@link #validate(Patch)}
 * at the start of every registration; nothing is clamped.
 */
public class CiratefiParameters
{
	public static int[] default_radii = new int[]{ 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11 };
	public static double[] default_scales = new double[]{ 1.0 };
	public static double default_alpha = Math.PI / 16;
	// share of candidates in percent that survives each stage
	public static double default_cifi_percentile = 5;
	public static double default_rafi_percentile = 5;
	public static double default_tefi_percentile = 1;
	public static int default_upsampling = 1;

	protected int[] radii;
	protected double[] scales;
	protected double alpha;
	protected Threshold cifiThreshold, rafiThreshold, tefiThreshold;
	protected int upsampling;

	public CiratefiParameters(
			final int[] radii,
			final double[] scales,
			final double alpha,
			final Threshold cifiThreshold,
			final Threshold rafiThreshold,
			final Threshold tefiThreshold,
			final int upsampling )
	{
		this.radii = radii == null ? null : radii.clone();
		this.scales = scales == null ? null : scales.clone();
		this.alpha = alpha;
		this.cifiThreshold = cifiThreshold;
		this.rafiThreshold = rafiThreshold;
		this.tefiThreshold = tefiThreshold;
		this.upsampling = upsampling;
	}

	public CiratefiParameters(
			final int[] radii,
			final double alpha,
			final Threshold cifiThreshold,
			final Threshold rafiThreshold,
			final Threshold tefiThreshold,
			final int upsampling )
	{
		this( radii, default_scales, alpha, cifiThreshold, rafiThreshold, tefiThreshold, upsampling );
	}

	public CiratefiParameters()
	{
		this(
				default_radii,
				default_scales,
				default_alpha,
				Threshold.percentile( default_cifi_percentile ),
				Threshold.percentile( default_rafi_percentile ),
				Threshold.percentile( default_tefi_percentile ),
				default_upsampling );
	}

	/**
	 * Maps the plain form of the thresholds, where one flag decides whether all three values are
	 * percentiles or absolute correlation cutoffs.
	 *
	 * @param radii - ring radii
	 * @param alpha - angular step in radians
	 * @param cifiThreshold - circular filter cutoff
	 * @param rafiThreshold - radial filter cutoff
	 * @param tefiThreshold - template filter cutoff
	 * @param usePercentile - if true all thresholds are the percentage in (0, 100] of candidates to keep
	 * @param upsampling - subpixel upsampling factor
	 * @return the parameters
	 */
	public static CiratefiParameters fromValues(
			final int[] radii,
			final double alpha,
			final double cifiThreshold,
			final double rafiThreshold,
			final double tefiThreshold,
			final boolean usePercentile,
			final int upsampling )
	{
		return new CiratefiParameters(
				radii,
				default_scales,
				alpha,
				usePercentile ? Threshold.percentile( cifiThreshold ) : Threshold.absolute( cifiThreshold ),
				usePercentile ? Threshold.percentile( rafiThreshold ) : Threshold.absolute( rafiThreshold ),
				usePercentile ? Threshold.percentile( tefiThreshold ) : Threshold.absolute( tefiThreshold ),
				upsampling );
	}

	public int[] getRadii() { return radii.clone(); }
	public int getMaxRadius() { return radii[ radii.length - 1 ]; }
	public double[] getScales() { return scales.clone(); }
	public double getAlpha() { return alpha; }
	public AngleSet getAngleSet() { return new AngleSet( alpha ); }
	public Threshold getCifiThreshold() { return cifiThreshold; }
	public Threshold getRafiThreshold() { return rafiThreshold; }
	public Threshold getTefiThreshold() { return tefiThreshold; }
	public int getUpsampling() { return upsampling; }

	public Threshold getThreshold( final Stage stage )
	{
		switch ( stage )
		{
			case CIFI: return cifiThreshold;
			case RAFI: return rafiThreshold;
			default: return tefiThreshold;
		}
	}

	/**
	 * Checks everything that does not depend on the patches.
	 *
	 * @throws InvalidConfigurationException if any value is out of range
	 */
	public void validate() throws InvalidConfigurationException
	{
		if ( radii == null || radii.length == 0 )
			throw new InvalidConfigurationException( "No radii specified." );

		for ( int k = 0; k < radii.length; ++k )
		{
			if ( radii[ k ] <= 0 )
				throw new InvalidConfigurationException( "Radii must be positive: " + Arrays.toString( radii ) );

			if ( k > 0 && radii[ k ] <= radii[ k - 1 ] )
				throw new InvalidConfigurationException( "Radii must be strictly increasing: " + Arrays.toString( radii ) );
		}

		if ( scales == null || scales.length == 0 )
			throw new InvalidConfigurationException( "No scales specified." );

		for ( int s = 0; s < scales.length; ++s )
		{
			if ( !( scales[ s ] > 0 ) || Double.isInfinite( scales[ s ] ) )
				throw new InvalidConfigurationException( "Scales must be positive and finite: " + Arrays.toString( scales ) );

			if ( s > 0 && scales[ s ] <= scales[ s - 1 ] )
				throw new InvalidConfigurationException( "Scales must be strictly increasing: " + Arrays.toString( scales ) );
		}

		if ( !( alpha > 0 && alpha < 2 * Math.PI ) )
			throw new InvalidConfigurationException( "Angular step alpha must be in (0, 2pi), but is " + alpha );

		if ( AngleSet.size( alpha ) > AngleSet.MAX_SIZE )
			throw new InvalidConfigurationException(
					"Angular step alpha " + alpha + " is too fine, it must yield at most " + AngleSet.MAX_SIZE + " rotations" );

		for ( final Stage stage : Stage.values() )
		{
			final Threshold t = getThreshold( stage );

			if ( t == null )
				throw new InvalidConfigurationException( "No threshold specified for " + stage.name() );

			if ( !t.isValid() )
				throw new InvalidConfigurationException(
						"Invalid " + stage.name() + " threshold " + t + ", " +
						( t.isPercentile() ? "percentiles must be in (0, 100]" : "correlations must be in [-1, 1]" ) );
		}

		if ( upsampling < 1 )
			throw new InvalidConfigurationException( "Upsampling factor must be at least 1, but is " + upsampling );
	}

	/**
	 * Checks all values, including that the largest radius fits into the template.
	 *
	 * @param template - the template patch
	 * @throws InvalidConfigurationException if any value is out of range
	 */
	public void validate( final Patch template ) throws InvalidConfigurationException
	{
		validate();

		final int maxRadius = Math.min( template.getWidth(), template.getHeight() ) / 2;

		if ( getMaxRadius() > maxRadius )
			throw new InvalidConfigurationException(
					"Largest radius " + getMaxRadius() + " exceeds half the smaller template dimension (" +
					template.getWidth() + "x" + template.getHeight() + " allows " + maxRadius + ")" );
	}

	@Override
	public String toString()
	{
		return "CiratefiParameters[radii=" + Arrays.toString( radii ) + ", scales=" + Arrays.toString( scales ) +
				", alpha=" + alpha + ", cifi=" + cifiThreshold + ", rafi=" + rafiThreshold + ", tefi=" + tefiThreshold +
				", upsampling=" + upsampling + "]";
	}
}
