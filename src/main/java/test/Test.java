package test;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.locks.ReentrantLock;

public class Test {
	@Retention(RetentionPolicy.RUNTIME)
	@Target({ElementType.METHOD, ElementType.TYPE})
	public @interface UiThread {}

	@Retention(RetentionPolicy.RUNTIME)
	@Target({ElementType.METHOD, ElementType.TYPE})
	public @interface Lockless {}

	@Retention(RetentionPolicy.RUNTIME)
	@Target({ElementType.METHOD, ElementType.TYPE})
	public @interface NonBlocking {}

	private final Object first = new Object();
	private final Object second = new Object();
	private final ReentrantLock lock = new ReentrantLock();
	private final CountDownLatch latch = new CountDownLatch(1);
	private int counter;

	// Lock-order inversion: firstThenSecond and secondThenFirst
	public void firstThenSecond() {
		synchronized (first) {
			synchronized (second) {
				counter++;
			}
		}
	}

	public void secondThenFirst() {
		synchronized (second) {
			synchronized (first) {
				counter--;
			}
		}
	}

	// Same order as firstThenSecond: no deadlock with it
	public void firstThenSecondAgain() {
		synchronized (first) {
			synchronized (second) {
				counter += 2;
			}
		}
	}

	// Blocks the UI thread directly
	@UiThread
	public void onUiSleep() throws InterruptedException {
		Thread.sleep(100);
	}

	// Blocks the UI thread through a helper
	@UiThread
	public void onUiAwait() throws InterruptedException {
		waitForLatch();
	}

	private void waitForLatch() throws InterruptedException {
		latch.await();
	}

	// Takes `lock` on the UI thread...
	@UiThread
	public void onUiLock() {
		lock.lock();
		try {
			counter = 0;
		} finally {
			lock.unlock();
		}
	}

	// ...while a background thread may block holding it
	public void backgroundBlockHoldingLock() throws InterruptedException {
		lock.lock();
		try {
			Thread.sleep(1000);
		} finally {
			lock.unlock();
		}
	}

	@Lockless
	public int locklessButLocks() {
		return incrementSynchronized();
	}

	public synchronized int incrementSynchronized() {
		return ++counter;
	}

	// The blocking callee is hidden from callers by the annotation
	@NonBlocking
	public void quietAwait() throws InterruptedException {
		latch.await();
	}

	@UiThread
	public void onUiCallsQuietAwait() throws InterruptedException {
		quietAwait();
	}

	// Static synchronized: locks Test.class
	public static synchronized void staticSync() {
		synchronized (Test.class) {
			System.out.println("reentrant on the class object");
		}
	}
}
