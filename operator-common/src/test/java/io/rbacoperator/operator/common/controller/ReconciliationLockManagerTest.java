/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.controller;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class ReconciliationLockManagerTest {
    // Same key, one after another
    @Test
    public void testLockUnlockLockUnlock() throws InterruptedException {
        ReconciliationLockManager lockMan = new ReconciliationLockManager();

        assertThat(lockMan.tryLock("my-lock", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.locks.size(), is(1));
        lockMan.unlock("my-lock");
        assertThat(lockMan.tryLock("my-lock", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.locks.size(), is(1));
        lockMan.unlock("my-lock");

        assertThat(lockMan.locks.size(), is(0));
    }

    // Parallel lock with different keys
    @Test
    public void testLockLockUnlockUnlock() throws InterruptedException {
        ReconciliationLockManager lockMan = new ReconciliationLockManager();

        assertThat(lockMan.tryLock("my-lock", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.tryLock("my-lock2", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.locks.size(), is(2));
        lockMan.unlock("my-lock");
        lockMan.unlock("my-lock2");

        assertThat(lockMan.locks.size(), is(0));
    }

    // Same key from another thread while the lock is held
    @Test
    public void testLockTimesOut() throws Exception {
        ReconciliationLockManager lockMan = new ReconciliationLockManager();

        assertThat(lockMan.tryLock("my-lock", 10, TimeUnit.MILLISECONDS), is(true));

        boolean lockedByOther = CompletableFuture.supplyAsync(() -> {
            try {
                return lockMan.tryLock("my-lock", 50, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        }).get(5, TimeUnit.SECONDS);

        assertThat(lockedByOther, is(false));
        assertThat(lockMan.locks.get("my-lock").lockQueue.get(), is(1));

        lockMan.unlock("my-lock");
        assertThat(lockMan.locks.size(), is(0));
    }

    // Same key, waiting for lock
    @Test
    public void testLockLockUnlock() throws Exception {
        ReconciliationLockManager lockMan = new ReconciliationLockManager();

        CountDownLatch waiting = new CountDownLatch(1);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch unlock = new CountDownLatch(1);
        CountDownLatch unlocked = new CountDownLatch(1);

        assertThat(lockMan.tryLock("my-lock", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.locks.size(), is(1));

        CompletableFuture<Void> async = CompletableFuture.runAsync(() -> {
            try {
                waiting.countDown();
                if (lockMan.tryLock("my-lock", 10_000, TimeUnit.MILLISECONDS)) {
                    locked.countDown();
                    unlock.await();
                    lockMan.unlock("my-lock");
                    unlocked.countDown();
                }
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        });

        waiting.await();
        long deadline = System.currentTimeMillis() + 5_000;
        while (lockMan.locks.get("my-lock").lockQueue.get() != 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(lockMan.locks.get("my-lock").lockQueue.get(), is(2));

        lockMan.unlock("my-lock");
        assertThat(locked.await(5, TimeUnit.SECONDS), is(true));

        unlock.countDown();
        assertThat(unlocked.await(5, TimeUnit.SECONDS), is(true));
        async.get(5, TimeUnit.SECONDS);

        assertThat(lockMan.locks.size(), is(0));
    }
}
