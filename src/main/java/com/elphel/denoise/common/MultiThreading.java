/**
 ** -----------------------------------------------------------------------------**
 ** MultiThreading.java
 **
 ** Thread array helpers for processing independent items in parallel
 **
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiThreading.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.denoise.common;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class MultiThreading {
	public static int THREADS_MAX = 100;

	public interface IndexedTask {
		void run(int index);
	}

	/* Create a Thread[] array as large as the number of processors available, but not
	 * more than maxCPUs (and not more than THREADS_MAX).
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static Thread[] newThreadArray(int maxCPUs) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus > maxCPUs)     n_cpus = maxCPUs;
		if (n_cpus > THREADS_MAX) n_cpus = THREADS_MAX;
		if (n_cpus < 1)           n_cpus = 1;
		return new Thread[n_cpus];
	}

	/**
	 * Run task for every index 0..num_items-1, items are distributed between threads
	 * through a shared counter. The first RuntimeException (or Error) thrown by a task
	 * stops scheduling of the remaining items and is rethrown in the calling thread.
	 * @param num_items number of items
	 * @param max_threads maximal number of threads, the actual number is also limited by CPUs and items
	 * @param task per-item work
	 */
	public static void runIndexed(
			final int num_items,
			final int max_threads,
			final IndexedTask task) {
		if (num_items <= 0) return;
		final Thread[] threads = newThreadArray(Math.min(max_threads, num_items));
		final AtomicInteger indxAtomic = new AtomicInteger(0);
		final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				@Override
				public void run() {
					for (int indx = indxAtomic.getAndIncrement(); indx < num_items; indx = indxAtomic.getAndIncrement()) {
						if (failure.get() != null) break;
						try {
							task.run(indx);
						} catch (RuntimeException | Error e) {
							failure.compareAndSet(null, e);
						}
					}
				}
			};
		}
		startAndJoin(threads);
		Throwable t = failure.get();
		if (t instanceof RuntimeException) throw (RuntimeException) t;
		if (t instanceof Error)            throw (Error) t;
	}

	/* Start all given threads and wait on each of them until all are done.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static void startAndJoin(Thread[] threads)
	{
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}
		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
	}
}
