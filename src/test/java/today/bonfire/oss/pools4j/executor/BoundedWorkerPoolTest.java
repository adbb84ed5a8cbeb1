package today.bonfire.oss.pools4j.executor;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static today.bonfire.oss.pools4j.TestUtils.eventually;

@Slf4j
class BoundedWorkerPoolTest {

  private final CountDownLatch    gate = new CountDownLatch(1);
  private       BoundedWorkerPool pool;

  @AfterEach
  void tearDown() {
    gate.countDown();
    if (pool != null) pool.release();
  }

  private Runnable blockingTask(CountDownLatch started) {
    return () -> {
      started.countDown();
      try {
        gate.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    };
  }

  @Test
  void rejectsInvalidArguments() {
    assertThatThrownBy(() -> new BoundedWorkerPool("p", 0, Duration.ofSeconds(1), true))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new BoundedWorkerPool("p", 1, Duration.ZERO, true))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @Timeout(10)
  void nonBlockingPoolRejectsWhenFull() throws InterruptedException {
    pool = new BoundedWorkerPool("nb", 2, Duration.ofSeconds(10), true);
    var started = new CountDownLatch(2);
    pool.submit(blockingTask(started));
    pool.submit(blockingTask(started));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(pool.running()).isEqualTo(2);
    assertThat(pool.free()).isZero();
    assertThatThrownBy(() -> pool.submit(() -> {})).isInstanceOf(WorkerPoolFullException.class);

    gate.countDown();
    assertThat(eventually(Duration.ofSeconds(5), () -> pool.free() == 2)).isTrue();
    pool.submit(() -> {});
  }

  @Test
  @Timeout(10)
  void blockingPoolWaitsForFreeWorker() throws InterruptedException {
    pool = new BoundedWorkerPool("b", 1, Duration.ofSeconds(10), false);
    var started = new CountDownLatch(1);
    pool.submit(blockingTask(started));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    var secondSubmitted = new AtomicBoolean(false);
    var secondRan       = new CountDownLatch(1);
    var submitter = new Thread(() -> {
      pool.submit(secondRan::countDown);
      secondSubmitted.set(true);
    });
    submitter.start();

    Thread.sleep(200);
    assertThat(secondSubmitted.get()).isFalse();

    gate.countDown();
    submitter.join(5000);
    assertThat(secondSubmitted.get()).isTrue();
    assertThat(secondRan.await(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  @Timeout(10)
  void waitingSubmitterIsRejectedWhenPoolIsReleased() throws InterruptedException {
    pool = new BoundedWorkerPool("b", 1, Duration.ofSeconds(10), false);
    var started = new CountDownLatch(1);
    pool.submit(blockingTask(started));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    var error     = new AtomicReference<Throwable>();
    var secondRan = new AtomicBoolean(false);
    var submitter = new Thread(() -> {
      try {
        pool.submit(() -> secondRan.set(true));
      } catch (Throwable t) {
        error.set(t);
      }
    });
    submitter.start();
    Thread.sleep(200);
    assertThat(submitter.isAlive()).isTrue();

    // release blocks on the gated task, so run it aside
    var releaser = new Thread(pool::release);
    releaser.start();

    submitter.join(2000);
    assertThat(submitter.isAlive()).isFalse();
    assertThat(error.get()).isInstanceOf(WorkerPoolClosedException.class);
    assertThat(pool.running()).isEqualTo(1);

    gate.countDown();
    releaser.join(5000);
    assertThat(secondRan.get()).isFalse();
  }

  @Test
  @Timeout(10)
  void subMillisecondExpiryIsAccepted() throws InterruptedException {
    pool = new BoundedWorkerPool("tiny", 1, Duration.ofNanos(500), true);
    var ran = new CountDownLatch(1);
    pool.submit(ran::countDown);
    assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  @Timeout(10)
  void releaseDrainsAcceptedTasksThenRejects() {
    pool = new BoundedWorkerPool("drain", 4, Duration.ofSeconds(10), false);
    var completed = new AtomicInteger();
    for (int i = 0; i < 8; i++) {
      pool.submit(() -> {
        try {
          Thread.sleep(50);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        completed.incrementAndGet();
      });
    }

    pool.release();

    assertThat(completed.get()).isEqualTo(8);
    assertThat(pool.isClosed()).isTrue();
    assertThatThrownBy(() -> pool.submit(() -> {})).isInstanceOf(WorkerPoolClosedException.class);
  }

  @Test
  @Timeout(10)
  void idleWorkersExpire() throws InterruptedException {
    pool = new BoundedWorkerPool("expiry", 3, Duration.ofMillis(100), true);
    var done = new CountDownLatch(3);
    for (int i = 0; i < 3; i++) {
      pool.submit(done::countDown);
    }
    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(pool.workers()).isPositive();

    assertThat(eventually(Duration.ofSeconds(5), () -> pool.workers() == 0)).isTrue();
    assertThat(pool.cap()).isEqualTo(3);
  }

  @Test
  @Timeout(10)
  void slotIsReturnedWhenTaskThrows() throws InterruptedException {
    pool = new BoundedWorkerPool("throws", 1, Duration.ofSeconds(10), true);
    pool.submit(() -> {
      throw new IllegalStateException("boom");
    });
    assertThat(eventually(Duration.ofSeconds(5), () -> pool.free() == 1)).isTrue();

    var ran = new CountDownLatch(1);
    pool.submit(ran::countDown);
    assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
  }
}
