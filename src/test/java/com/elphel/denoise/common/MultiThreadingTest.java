package com.elphel.denoise.common;

import java.util.concurrent.atomic.AtomicIntegerArray;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MultiThreadingTest {

	@Test
	void everyIndexRunsExactlyOnce() {
		AtomicIntegerArray hits = new AtomicIntegerArray(257);
		MultiThreading.runIndexed(hits.length(), 8, hits::incrementAndGet);
		for (int i = 0; i < hits.length(); i++) {
			Assertions.assertEquals(1, hits.get(i), "index " + i);
		}
	}

	@Test
	void singleThreadAndNoItems() {
		AtomicIntegerArray hits = new AtomicIntegerArray(5);
		MultiThreading.runIndexed(5, 1, hits::incrementAndGet);
		Assertions.assertEquals(1, hits.get(4));
		MultiThreading.runIndexed(0, 4, index -> Assertions.fail("no items"));
	}

	@Test
	void taskFailureIsRethrown() {
		IllegalStateException thrown = Assertions.assertThrows(IllegalStateException.class,
				() -> MultiThreading.runIndexed(20, 4, index -> {
					if (index == 7) {
						throw new IllegalStateException("slice " + index);
					}
				}));
		Assertions.assertEquals("slice 7", thrown.getMessage());
	}

	@Test
	void threadArrayIsBounded() {
		Assertions.assertEquals(1, MultiThreading.newThreadArray(0).length);
		Assertions.assertTrue(MultiThreading.newThreadArray(1000).length <= MultiThreading.THREADS_MAX);
	}
}
