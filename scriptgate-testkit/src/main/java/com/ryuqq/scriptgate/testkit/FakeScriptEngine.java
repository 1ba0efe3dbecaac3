package com.ryuqq.scriptgate.testkit;

import com.ryuqq.scriptgate.core.date.CalendarDate;
import com.ryuqq.scriptgate.core.date.LocaleIndependentDateCodec;
import com.ryuqq.scriptgate.core.spi.EngineResponse;
import com.ryuqq.scriptgate.core.spi.ScriptEngine;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scriptable in-memory {@link ScriptEngine} for testing purposes.
 *
 * <p>Replaces the real engine process so executors, queues and gateways can be tested
 * deterministically.</p>
 *
 * <p><strong>Reply resolution (first match wins):</strong></p>
 * <ol>
 *   <li>Replies queued with {@link #enqueue(EngineResponse...)} / {@link #enqueue(Reply)}, consumed FIFO</li>
 *   <li>Rules registered with {@link #when(String, EngineResponse)}, matched by script fragment</li>
 *   <li>Date scripts: {@code set v to current date} / {@code set <prop> of v to <value>} lines are
 *       interpreted with {@link FakeEngineDate} and the numeric readout is answered</li>
 *   <li>The default reply (empty success unless changed)</li>
 * </ol>
 *
 * <p><strong>Concurrency counters:</strong></p>
 * <ul>
 *   <li>{@link #hold()} / {@link #release()}: block every call until released (interruptibly)</li>
 *   <li>{@link #maxConcurrency()}: highest number of calls observed in flight at once</li>
 *   <li>{@link #awaitInFlight(int, Duration)}: wait until N calls are blocked inside the engine</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public class FakeScriptEngine implements ScriptEngine {

    /**
     * Scripted answer to one engine call.
     */
    @FunctionalInterface
    public interface Reply {
        EngineResponse apply(String script) throws IOException, InterruptedException;
    }

    private static final Pattern BASE_LINE = Pattern.compile("^set\\s+(\\w+)\\s+to\\s+current date$");
    private static final Pattern PROPERTY_LINE =
        Pattern.compile("^set\\s+(year|month|day|time)\\s+of\\s+(\\w+)\\s+to\\s+(\\w+)$");
    private static final Pattern READOUT = Pattern.compile("\\(year of (\\w+) as integer\\)");

    private final Queue<Reply> queued = new ConcurrentLinkedQueue<>();
    private final List<Rule> rules = new CopyOnWriteArrayList<>();
    private final List<String> scripts = new CopyOnWriteArrayList<>();

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger dateOverflows = new AtomicInteger();
    private final Object monitor = new Object();

    private volatile Reply defaultReply = script -> EngineResponse.success("");
    private volatile CalendarDate currentDate = CalendarDate.of(2025, 1, 15);
    private volatile CountDownLatch gate = new CountDownLatch(0);

    @Override
    public EngineResponse run(String script, Duration timeout) throws IOException, InterruptedException {
        if (script == null) {
            throw new IllegalArgumentException("script cannot be null");
        }
        scripts.add(script);
        calls.incrementAndGet();
        CountDownLatch entryGate = gate;
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        signal();
        try {
            entryGate.await();
            return resolve(script).apply(script);
        } finally {
            inFlight.decrementAndGet();
            signal();
        }
    }

    private Reply resolve(String script) {
        Reply next = queued.poll();
        if (next != null) {
            return next;
        }
        for (Rule rule : rules) {
            if (script.contains(rule.fragment())) {
                return rule.reply();
            }
        }
        if (script.contains("to current date")) {
            return this::interpretDateScript;
        }
        return defaultReply;
    }

    private EngineResponse interpretDateScript(String script) {
        Map<String, FakeEngineDate> dates = new HashMap<>();
        for (String raw : script.split("\\R")) {
            String line = raw.strip();
            Matcher base = BASE_LINE.matcher(line);
            if (base.matches()) {
                dates.put(base.group(1), FakeEngineDate.of(currentDate));
                continue;
            }
            Matcher property = PROPERTY_LINE.matcher(line);
            if (property.matches()) {
                FakeEngineDate date = dates.get(property.group(2));
                if (date == null) {
                    return undefinedVariable(property.group(2));
                }
                int before = date.overflows();
                try {
                    assign(date, property.group(1), property.group(3));
                } catch (IllegalArgumentException e) {
                    return EngineResponse.failure(1, "execution error: Invalid date and time. (-30720)");
                }
                dateOverflows.addAndGet(date.overflows() - before);
            }
        }

        Matcher readout = READOUT.matcher(script);
        if (!readout.find()) {
            return EngineResponse.success("");
        }
        FakeEngineDate date = dates.get(readout.group(1));
        if (date == null) {
            return undefinedVariable(readout.group(1));
        }
        return EngineResponse.success(date.readout());
    }

    private static void assign(FakeEngineDate date, String property, String value) {
        switch (property) {
            case "year" -> date.setYear(Integer.parseInt(value));
            case "month" -> date.setMonth(parseMonth(value));
            case "day" -> date.setDay(Integer.parseInt(value));
            case "time" -> date.setTime(Integer.parseInt(value));
            default -> throw new IllegalArgumentException("Unknown date property: " + property);
        }
    }

    private static int parseMonth(String value) {
        for (int month = 1; month <= 12; month++) {
            if (LocaleIndependentDateCodec.monthConstant(month).equalsIgnoreCase(value)) {
                return month;
            }
        }
        return Integer.parseInt(value);
    }

    private static EngineResponse undefinedVariable(String name) {
        return EngineResponse.failure(1, "execution error: The variable " + name + " is not defined. (-2753)");
    }

    // ---- scripting ----

    public FakeScriptEngine enqueue(EngineResponse... responses) {
        for (EngineResponse response : responses) {
            queued.add(script -> response);
        }
        return this;
    }

    public FakeScriptEngine enqueue(Reply reply) {
        queued.add(reply);
        return this;
    }

    /**
     * Queues a spawn failure, as if the engine binary could not be started.
     */
    public FakeScriptEngine enqueueSpawnFailure(String message) {
        queued.add(script -> {
            throw new IOException(message);
        });
        return this;
    }

    public FakeScriptEngine when(String fragment, EngineResponse response) {
        return when(fragment, script -> response);
    }

    public FakeScriptEngine when(String fragment, Reply reply) {
        if (fragment == null || fragment.isEmpty()) {
            throw new IllegalArgumentException("fragment cannot be null or empty");
        }
        rules.add(new Rule(fragment, reply));
        return this;
    }

    public FakeScriptEngine respondByDefault(EngineResponse response) {
        this.defaultReply = script -> response;
        return this;
    }

    /**
     * Sets what {@code current date} evaluates to inside date scripts.
     */
    public FakeScriptEngine currentDate(CalendarDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        this.currentDate = date;
        return this;
    }

    // ---- concurrency counters ----

    /**
     * Blocks every call that enters from now on until {@link #release()}.
     */
    public void hold() {
        gate = new CountDownLatch(1);
    }

    public void release() {
        gate.countDown();
    }

    /**
     * Waits until at least {@code count} calls are inside the engine at once.
     *
     * @return true if reached before the timeout
     */
    public boolean awaitInFlight(int count, Duration timeout) throws InterruptedException {
        return awaitCondition(() -> inFlight.get() >= count, timeout);
    }

    /**
     * Waits until at least {@code count} calls have entered the engine in total.
     *
     * @return true if reached before the timeout
     */
    public boolean awaitCalls(int count, Duration timeout) throws InterruptedException {
        return awaitCondition(() -> calls.get() >= count, timeout);
    }

    private boolean awaitCondition(BooleanSupplier condition, Duration timeout)
        throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            while (!condition.getAsBoolean()) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMillis <= 0) {
                    return false;
                }
                monitor.wait(remainingMillis);
            }
            return true;
        }
    }

    private void signal() {
        synchronized (monitor) {
            monitor.notifyAll();
        }
    }

    // ---- observations ----

    public int calls() {
        return calls.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int maxConcurrency() {
        return maxInFlight.get();
    }

    /**
     * Total number of day spills observed while interpreting date scripts.
     */
    public int dateOverflows() {
        return dateOverflows.get();
    }

    public List<String> scripts() {
        return List.copyOf(scripts);
    }

    public String lastScript() {
        return scripts.isEmpty() ? null : scripts.get(scripts.size() - 1);
    }

    private record Rule(String fragment, Reply reply) {
    }
}
