/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool;

import io.opentelemetry.sdk.extension.taskpool.config.TaskPoolConfig;
import io.opentelemetry.sdk.extension.taskpool.core.CompletionTracker;
import io.opentelemetry.sdk.extension.taskpool.core.PoolStateManager;
import io.opentelemetry.sdk.extension.taskpool.core.PoolStateManager.StateChangeListener;
import io.opentelemetry.sdk.extension.taskpool.core.PoolTask;
import io.opentelemetry.sdk.extension.taskpool.core.TaskPoolStatistics;
import io.opentelemetry.sdk.extension.taskpool.core.TaskQueue;
import io.opentelemetry.sdk.extension.taskpool.core.Worker;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 有界并发任务池。
 *
 * <p>固定数量（可通过 {@link #reboot(int)} 调整）的工作线程从共享 FIFO 队列中取任务执行，
 * 提交方得到一个 {@link CompletableFuture} 用于获取结果或失败。
 *
 * <ul>
 *   <li>提交：{@link #submit(Callable)} 及其重载，任务池未运行时抛出 {@link TaskPoolException}
 *   <li>等待：{@link #waitAll()} 阻塞直到队列为空且没有任务在执行
 *   <li>关闭：{@link #shutdown(ShutdownMode)} 幂等，等待所有工作线程退出
 *   <li>重启：{@link #reboot(int)} 先以等待模式关闭，再启动新的工作线程
 *   <li>状态：{@link #getStatus()} 等只读查询
 * </ul>
 *
 * <p>任务体抛出的异常写入其 Future，不会影响工作线程或其他任务。关闭时被丢弃的任务，
 * 其 Future 被取消。
 */
public final class TaskPool implements Executor, Closeable {

  private static final Logger logger = Logger.getLogger(TaskPool.class.getName());

  /** 工作线程数上限 */
  public static final int MAX_THREADS = TaskPoolConfig.MAX_THREADS;

  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

  private final TaskQueue queue;
  private final CompletionTracker completionTracker;
  private final PoolStateManager stateManager;
  private final TaskPoolStatistics statistics;

  /** 串行化关闭时的 join 与重启时的启动 */
  private final ReentrantLock lifecycleLock = new ReentrantLock();

  private final String threadNamePrefix;
  private final ThreadFactory threadFactory;
  private final ShutdownMode closeShutdownMode;

  /** 当前工作线程集合，仅在持有 lifecycleLock 时整体替换 */
  private volatile List<Thread> workers = Collections.emptyList();

  /** 创建任务池，线程数为 {@link TaskPoolConfig#defaultThreadCount()} */
  public TaskPool() {
    this(TaskPoolConfig.builder().build());
  }

  /**
   * 创建任务池
   *
   * @param threadCount 工作线程数，范围 [1, {@value TaskPoolConfig#MAX_THREADS}]
   * @throws TaskPoolException 线程数不合法
   */
  public TaskPool(int threadCount) {
    this(TaskPoolConfig.builder().setThreadCount(threadCount).build());
  }

  private TaskPool(TaskPoolConfig config) {
    this(config, workerThreadFactory(config.getThreadNamePrefix(), config.isDaemon()));
  }

  /**
   * 创建任务池，工作线程由指定工厂创建
   *
   * @param config 任务池配置
   * @param threadFactory 工作线程工厂，名称和守护标记由工厂决定
   */
  TaskPool(TaskPoolConfig config, ThreadFactory threadFactory) {
    this.queue = new TaskQueue();
    this.completionTracker = new CompletionTracker(queue::isDrained);
    this.stateManager = new PoolStateManager();
    this.statistics = new TaskPoolStatistics(config.getStatusLogInterval().toMillis());
    this.threadNamePrefix = config.getThreadNamePrefix();
    this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
    this.closeShutdownMode = config.getCloseShutdownMode();

    lifecycleLock.lock();
    try {
      launch(config.getThreadCount());
    } finally {
      lifecycleLock.unlock();
    }
  }

  /**
   * 按配置创建任务池
   *
   * @param config 任务池配置
   * @return 任务池
   */
  public static TaskPool create(TaskPoolConfig config) {
    return new TaskPool(Objects.requireNonNull(config, "config"));
  }

  // ===== 提交 =====

  /**
   * 提交任务
   *
   * @param task 任务
   * @param <T> 返回值类型
   * @return 任务结果；任务抛出的异常以异常完成的形式体现
   * @throws TaskPoolException 任务池未运行（{@link TaskPoolException.Type#NOT_RUNNING}）
   */
  public <T> CompletableFuture<T> submit(Callable<T> task) {
    Objects.requireNonNull(task, "task");
    PoolTask<T> poolTask = new PoolTask<>(task);
    if (!queue.offer(poolTask)) {
      statistics.recordRejected();
      logger.log(Level.FINE, "Rejected task submission, pool state: {0}", stateManager.getState());
      throw TaskPoolException.notRunning();
    }
    statistics.recordSubmitted();
    return poolTask.getFuture();
  }

  /**
   * 提交无返回值任务
   *
   * @param task 任务
   * @return 任务完成时以 null 完成的 Future
   * @throws TaskPoolException 任务池未运行
   */
  public CompletableFuture<Void> submit(Runnable task) {
    Objects.requireNonNull(task, "task");
    return submit(
        () -> {
          task.run();
          return null;
        });
  }

  /**
   * 提交带一个参数的任务
   *
   * @param function 任务函数
   * @param argument 参数
   * @param <A> 参数类型
   * @param <T> 返回值类型
   * @return 任务结果
   * @throws TaskPoolException 任务池未运行
   */
  public <A, T> CompletableFuture<T> submit(Function<? super A, ? extends T> function, A argument) {
    Objects.requireNonNull(function, "function");
    return submit(() -> function.apply(argument));
  }

  /**
   * 提交带两个参数的任务
   *
   * @param function 任务函数
   * @param first 第一个参数
   * @param second 第二个参数
   * @param <A> 第一个参数类型
   * @param <B> 第二个参数类型
   * @param <T> 返回值类型
   * @return 任务结果
   * @throws TaskPoolException 任务池未运行
   */
  public <A, B, T> CompletableFuture<T> submit(
      BiFunction<? super A, ? super B, ? extends T> function, A first, B second) {
    Objects.requireNonNull(function, "function");
    return submit(() -> function.apply(first, second));
  }

  /**
   * 提交任务，不关心结果
   *
   * <p>任务失败只体现在统计信息中。按 {@link Executor} 约定，拒绝以
   * {@link RejectedExecutionException} 表示，其 cause 为 {@link TaskPoolException}。
   *
   * @param command 任务
   * @throws RejectedExecutionException 任务池未运行
   */
  @Override
  @SuppressWarnings("FutureReturnValueIgnored")
  public void execute(Runnable command) {
    try {
      submit(command);
    } catch (TaskPoolException e) {
      throw new RejectedExecutionException(e.getMessage(), e);
    }
  }

  // ===== 等待 =====

  /**
   * 阻塞直到队列为空且没有任务在执行
   *
   * <p>返回只说明调用期间某一时刻任务池已排空，不阻止其他线程继续提交。不响应中断，
   * 被中断时返回前恢复中断标记。
   *
   * @throws TaskPoolException 在本任务池的工作线程中调用（{@link TaskPoolException.Type#ILLEGAL_STATE}），
   *     该线程自身处于忙碌状态，等待永远不会结束
   */
  public void waitAll() {
    checkNotWorkerThread("waitAll");
    completionTracker.awaitDrained();
  }

  /**
   * 阻塞直到排空或超时
   *
   * @param timeout 超时时间
   * @return 是否在超时前排空
   * @throws InterruptedException 等待期间被中断
   * @throws TaskPoolException 在本任务池的工作线程中调用
   */
  public boolean waitAll(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    checkNotWorkerThread("waitAll");
    return completionTracker.awaitDrained(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
  }

  /** 超出 long 范围的时长截断为 Long.MAX_VALUE 纳秒，负数视为 0 */
  static long saturatedNanos(Duration timeout) {
    if (timeout.isNegative()) {
      return 0L;
    }
    if (timeout.compareTo(MAX_NANOS) >= 0) {
      return Long.MAX_VALUE;
    }
    return timeout.toNanos();
  }

  // ===== 关闭 / 重启 =====

  /** 以 {@link ShutdownMode#WAIT_FOR_ALL_TASKS} 模式关闭 */
  public void shutdown() {
    shutdown(ShutdownMode.WAIT_FOR_ALL_TASKS);
  }

  /**
   * 关闭任务池
   *
   * <p>幂等：已停止时直接返回。停止接收任务、按模式处理队列、唤醒并 join 所有工作线程后返回；
   * 并发的第二次调用会等待第一次完成后返回。在本任务池的工作线程中调用时只停止接收任务并唤醒
   * 工作线程，不做 join。
   *
   * @param mode 关闭模式
   */
  public void shutdown(ShutdownMode mode) {
    Objects.requireNonNull(mode, "mode");
    if (stateManager.isStopped()) {
      return;
    }
    if (Worker.isWorkerOf(this)) {
      beginShutdown(mode);
      return;
    }

    lifecycleLock.lock();
    try {
      if (stateManager.isStopped()) {
        return;
      }
      beginShutdown(mode);
      joinWorkers();
      stateManager.markStopped();
      // 工作线程全部退出后队列必然为空
      completionTracker.signalIfDrained();
    } finally {
      lifecycleLock.unlock();
    }
  }

  /**
   * 重启任务池
   *
   * <p>先以 {@link ShutdownMode#WAIT_FOR_ALL_TASKS} 模式关闭（运行中的任务池会先排空），
   * 再启动指定数量的工作线程。若在关闭与启动之间已有并发的重启完成了启动，则直接返回。
   *
   * @param threadCount 新的工作线程数
   * @throws TaskPoolException 线程数不合法（任务池保持原状态），或在本任务池的工作线程中调用
   */
  public void reboot(int threadCount) {
    TaskPoolConfig.checkThreadCount(threadCount);
    checkNotWorkerThread("reboot");

    shutdown(ShutdownMode.WAIT_FOR_ALL_TASKS);

    lifecycleLock.lock();
    try {
      if (queue.isRunning()) {
        logger.log(Level.FINE, "Task pool already relaunched by a concurrent reboot");
        return;
      }
      launch(threadCount);
    } finally {
      lifecycleLock.unlock();
    }
  }

  /** 按配置的关闭模式（默认等待所有任务）关闭 */
  @Override
  public void close() {
    shutdown(closeShutdownMode);
  }

  // ===== 状态 =====

  public boolean isRunning() {
    return queue.isRunning();
  }

  public PoolState getState() {
    return stateManager.getState();
  }

  /**
   * 获取当前工作线程数
   *
   * @return 工作线程数，停止后为 0
   */
  public int getTotalThreads() {
    return workers.size();
  }

  public int getBusyThreads() {
    return queue.getBusyCount();
  }

  public int getIdleThreads() {
    return Math.max(0, getTotalThreads() - getBusyThreads());
  }

  public int getPendingTasks() {
    return queue.size();
  }

  /**
   * 获取状态快照
   *
   * @return 状态快照
   */
  public TaskPoolStatus getStatus() {
    return queue.snapshot(workers.size());
  }

  public TaskPoolStatistics getStatistics() {
    return statistics;
  }

  /**
   * 添加生命周期状态监听器
   *
   * @param listener 监听器
   */
  public void addStateListener(StateChangeListener listener) {
    stateManager.addListener(listener);
  }

  /**
   * 移除生命周期状态监听器
   *
   * @param listener 监听器
   */
  public void removeStateListener(StateChangeListener listener) {
    stateManager.removeListener(listener);
  }

  // ===== 内部实现 =====

  /**
   * 持有 lifecycleLock 时调用
   *
   * <p>任一线程创建或启动失败时，关闭队列、join 已启动的线程并回到 STOPPED，再抛出原异常。
   */
  private void launch(int threadCount) {
    queue.open();
    List<Thread> started = new ArrayList<>(threadCount);
    try {
      for (int i = 0; i < threadCount; i++) {
        Worker worker = new Worker(this, queue, completionTracker, statistics, this::getStatus);
        Thread thread = threadFactory.newThread(worker);
        thread.start();
        started.add(thread);
      }
    } catch (RuntimeException | Error e) {
      abortLaunch(started, e);
      throw e;
    }
    workers = Collections.unmodifiableList(started);
    stateManager.markRunning(threadCount, threadNamePrefix);
  }

  /** 持有 lifecycleLock 时调用 */
  private void abortLaunch(List<Thread> started, Throwable failure) {
    logger.log(
        Level.WARNING,
        "Failed to launch task pool worker thread, stopping {0} started workers: {1}",
        new Object[] {started.size(), failure.toString()});
    discard(queue.close(ShutdownMode.DISCARD_PENDING_TASKS));
    workers = Collections.unmodifiableList(started);
    joinWorkers();
    stateManager.markStopped();
    completionTracker.signalIfDrained();
  }

  private static ThreadFactory workerThreadFactory(String prefix, boolean daemon) {
    AtomicInteger sequence = new AtomicInteger(0);
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
      thread.setDaemon(daemon);
      return thread;
    };
  }

  private void beginShutdown(ShutdownMode mode) {
    List<PoolTask<?>> discarded = queue.close(mode);
    stateManager.markShuttingDown(mode);
    discard(discarded);
    completionTracker.signalIfDrained();
  }

  private void discard(List<PoolTask<?>> discarded) {
    if (discarded.isEmpty()) {
      return;
    }
    for (PoolTask<?> task : discarded) {
      task.discard();
    }
    statistics.recordDiscarded(discarded.size());
    logger.log(Level.FINE, "Discarded {0} pending tasks", discarded.size());
  }

  /** 持有 lifecycleLock 时调用，join 当前工作线程集合中的所有线程 */
  private void joinWorkers() {
    boolean interrupted = false;
    for (Thread worker : workers) {
      while (true) {
        try {
          worker.join();
          break;
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    }
    workers = Collections.emptyList();
    if (interrupted) {
      logger.log(Level.WARNING, "Interrupted while joining task pool workers");
      Thread.currentThread().interrupt();
    }
  }

  private void checkNotWorkerThread(String operation) {
    if (Worker.isWorkerOf(this)) {
      throw TaskPoolException.illegalState(
          operation + " cannot be invoked from a worker thread of the same pool");
    }
  }
}
