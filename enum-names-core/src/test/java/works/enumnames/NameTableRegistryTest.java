package works.enumnames;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NameTableRegistryTest {
	enum Color { RED, GREEN, BLUE }

	enum Shape {
		CIRCLE { @Override public String toString() { return "()"; } },
		SQUARE
	}

	NameTableRegistry registry;

	@BeforeEach
	void setUp() {
		registry = new NameTableRegistry();
	}

	@Test
	void tableFor_returnsSameInstance() {
		NameTable<Color> first = registry.tableFor(Color.class);
		assertSame(first, registry.tableFor(Color.class));
		assertEquals(Set.of(Color.class), registry.knownTypes());
	}

	@Test
	void separateRegistries_doNotShareTables() {
		NameTableRegistry other = new NameTableRegistry();
		assertNotSame(registry.tableFor(Color.class), other.tableFor(Color.class));
	}

	@Test
	void newRegistry_isEmpty() {
		assertTrue(registry.knownTypes().isEmpty());
	}

	@Test
	void tableForClass_normalizesConstantBody() {
		Class<?> bodyClass = Shape.CIRCLE.getClass();
		assertNotSame(Shape.class, bodyClass);
		assertSame(registry.tableFor(Shape.class), registry.tableForClass(bodyClass));
		assertEquals(Set.of(Shape.class), registry.knownTypes());
	}

	@Test
	void tableForClass_nonEnum_throws() {
		assertThrows(IllegalArgumentException.class, () -> registry.tableForClass(String.class));
		assertThrows(IllegalArgumentException.class, () -> registry.tableForClass(Enum.class));
		assertTrue(registry.knownTypes().isEmpty());
	}

	@Test
	void isEnumClass_works() {
		assertTrue(NameTableRegistry.isEnumClass(Color.class));
		assertTrue(NameTableRegistry.isEnumClass(Shape.CIRCLE.getClass()));
		assertTrue(NameTableRegistry.isEnumClass(Shape.SQUARE.getClass()));
		assertFalse(NameTableRegistry.isEnumClass(Enum.class));
		assertFalse(NameTableRegistry.isEnumClass(Object.class));
		assertFalse(NameTableRegistry.isEnumClass(String.class));
	}

	@Test
	void concurrentFirstUse_buildsOneTable() throws Exception {
		int numThreads = 16;
		ExecutorService executor = Executors.newFixedThreadPool(numThreads);
		try {
			CountDownLatch start = new CountDownLatch(1);
			List<Future<NameTable<Color>>> futures = new ArrayList<>();
			for (int i = 0; i < numThreads; i++) {
				futures.add(executor.submit(() -> {
					start.await();
					return registry.tableFor(Color.class);
				}));
			}
			start.countDown();
			NameTable<Color> expected = futures.get(0).get(10, SECONDS);
			for (Future<NameTable<Color>> future : futures) {
				assertSame(expected, future.get(10, SECONDS));
			}
			assertEquals(Set.of(Color.class), registry.knownTypes());
		} finally {
			executor.shutdownNow();
		}
	}
}
