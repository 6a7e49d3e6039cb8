package starvation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

public class LockTest {

	@Test
	public void outerInstanceFieldsAreCollapsed() {
		Exp.Var innerThis = new Exp.Var("this", "pkg.Outer$Inner", false);
		Exp.Var outerThis = new Exp.Var("this", "pkg.Outer", false);
		Exp.Field outer = new Exp.Field("this$0", "pkg.Outer");
		Exp.Field mutex = new Exp.Field("mutex", "java.lang.Object");

		Lock viaInner = Lock.of(innerThis, List.of(outer, mutex));
		Lock direct = Lock.of(outerThis, List.of(mutex));
		assertEquals(direct, viaInner);
		assertEquals(direct.hashCode(), viaInner.hashCode());
		assertEquals("pkg.Outer", viaInner.ownerClass().get());
	}

	@Test
	public void globalLockIsOwnedByDeclaringClass() {
		Exp.Var cls = new Exp.Var("pkg.Registry", "pkg.Registry", true);
		Lock lock = Lock.of(Exp.access(cls, new Exp.Field("LOCK", "java.lang.Object")));
		assertEquals(Lock.Kind.GLOBAL, lock.getKind());
		assertEquals("pkg.Registry", lock.ownerClass().get());
		assertEquals("Registry.LOCK", lock.toString());
	}

	@Test
	public void classObjectHasNoOwner() {
		Lock lock = Lock.ofClass("pkg.Sample");
		assertTrue(lock.isClassObject());
		assertFalse(lock.ownerClass().isPresent());
		assertEquals(Lock.CLASS_TYPE, lock.typeName());
		assertEquals("`Sample.class`", lock.describe());
		assertEquals(Lock.ofClass("pkg.Sample"), lock);
		assertNotEquals(Lock.ofClass("pkg.Other"), lock);
	}

	@Test
	public void distinctRootsAreDistinctLocks() {
		Exp.Var a = new Exp.Var("param1", "java.lang.Object", false);
		Exp.Var b = new Exp.Var("param2", "java.lang.Object", false);
		Lock la = Lock.of(a, List.of());
		Lock lb = Lock.of(b, List.of());
		assertNotEquals(la, lb);
		assertNotEquals(0, la.compareTo(lb));
	}
}
