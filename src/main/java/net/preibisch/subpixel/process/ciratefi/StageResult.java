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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one funnel stage: how many inputs were evaluated, which ones produced a defined
 * score, the resolved cutoff and the survivors.
 */
public class StageResult
{
	final Stage stage;
	final int evaluated;
	final List< Candidate > scored, survivors;
	final double cutoff;

	public StageResult( final Stage stage, final int evaluated, final List< Candidate > scored, final double cutoff, final List< Candidate > survivors )
	{
		this.stage = stage;
		this.evaluated = evaluated;
		this.scored = Collections.unmodifiableList( scored );
		this.cutoff = cutoff;
		this.survivors = Collections.unmodifiableList( survivors );
	}

	public Stage getStage() { return stage; }
	public int getNumEvaluated() { return evaluated; }
	public List< Candidate > getScored() { return scored; }
	public double getCutoff() { return cutoff; }
	public List< Candidate > getSurvivors() { return survivors; }
	public boolean isExhausted() { return survivors.isEmpty(); }

	@Override
	public String toString()
	{
		return stage.name() + ": " + survivors.size() + " of " + evaluated + " survived (" + scored.size() + " scored, cutoff=" + cutoff + ")";
	}
}
