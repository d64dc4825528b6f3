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
package net.preibisch.subpixel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.Prefs;

public class Threads
{
	private static final Logger LOG = LoggerFactory.getLogger( Threads.class );

	/**
	 * @return num threads for the executorService, taken from the ImageJ preferences
	 */
	public static int numThreads() { return Math.max( 1, Prefs.getThreads() ); }

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }

	/**
	 * Splits [0, size) into contiguous ranges, at most one per thread plus remainder.
	 *
	 * @param size - number of elements
	 * @param numTasks - requested number of ranges
	 * @return list of {start, end} pairs (end exclusive), in ascending order
	 */
	public static List< int[] > splitRange( final int size, final int numTasks )
	{
		final ArrayList< int[] > ranges = new ArrayList<>();

		if ( size <= 0 )
			return ranges;

		final int n = Math.max( 1, Math.min( size, numTasks ) );
		final int perTask = size / n + ( size % n == 0 ? 0 : 1 );

		for ( int start = 0; start < size; start += perTask )
			ranges.add( new int[]{ start, Math.min( size, start + perTask ) } );

		return ranges;
	}

	/**
	 * Runs all tasks and returns their results in the order of the tasks, independent of
	 * the order in which they finished.
	 *
	 * @param tasks - the tasks
	 * @param service - the executor
	 * @param jobDescription - used in error messages
	 * @param <T> - result type
	 * @return the results, one per task
	 */
	public static < T > ArrayList< T > execTasks( final List< Callable< T > > tasks, final ExecutorService service, final String jobDescription )
	{
		final ArrayList< T > results = new ArrayList<>( tasks.size() );

		try
		{
			// invokeAll() returns when all tasks are complete
			for ( final Future< T > future : service.invokeAll( tasks ) )
				results.add( future.get() );
		}
		catch ( final InterruptedException e )
		{
			LOG.warn( "Interrupted while trying to " + jobDescription );
			Thread.currentThread().interrupt();
			throw new RuntimeException( "Interrupted while trying to " + jobDescription, e );
		}
		catch ( final ExecutionException e )
		{
			if ( e.getCause() instanceof RuntimeException )
				throw (RuntimeException)e.getCause();

			throw new RuntimeException( "Failed to " + jobDescription + ": " + e.getCause(), e.getCause() );
		}

		return results;
	}
}
