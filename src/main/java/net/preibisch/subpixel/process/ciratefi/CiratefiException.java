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
 * Base class of all errors a registration call can fail with before producing a result.
 */
public class CiratefiException extends Exception
{
	private static final long serialVersionUID = 4402916340958712553L;

	public CiratefiException( final String message ) { super( message ); }
	public CiratefiException( final String message, final Throwable cause ) { super( message, cause ); }
}
