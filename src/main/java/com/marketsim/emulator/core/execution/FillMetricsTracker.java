package com.marketsim.emulator.core.execution;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.support.Numbers;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Rolling window of recent fill quality, bounded both by age and by point count.
 */
@Component
public class FillMetricsTracker {

    private static final long MIN_WINDOW_MS = 1000;

    private final Clock clock;
    private final long memoryMs;
    private final int maxPoints;
    private final Deque<Point> points = new ArrayDeque<>();

    public FillMetricsTracker(Clock clock, EmulatorProperties properties) {
        this.clock = clock;
        this.memoryMs = properties.getExecution().getMetricsMemoryMs();
        this.maxPoints = properties.getExecution().getMaxFillMetrics();
    }

    public synchronized void record(long timestampMs, double slippageBps, double executionQualityScore) {
        points.addLast(new Point(timestampMs, slippageBps, executionQualityScore));
        while (points.size() > maxPoints) {
            points.removeFirst();
        }
        long cutoff = timestampMs - memoryMs;
        while (!points.isEmpty() && points.peekFirst().timestampMs() < cutoff) {
            points.removeFirst();
        }
    }

    public synchronized FillMetrics recentMetrics(long windowMs) {
        long window = Math.max(MIN_WINDOW_MS, windowMs);
        long cutoff = clock.millis() - window;
        int count = 0;
        double slippageSum = 0;
        double qualitySum = 0;
        Iterator<Point> newestFirst = points.descendingIterator();
        while (newestFirst.hasNext()) {
            Point point = newestFirst.next();
            if (point.timestampMs() < cutoff) {
                break;
            }
            count++;
            slippageSum += point.slippageBps();
            qualitySum += point.executionQualityScore();
        }
        return new FillMetrics(window, count,
                count > 0 ? Numbers.round(slippageSum / count, 4) : 0,
                count > 0 ? Numbers.round(qualitySum / count, 4) : 0);
    }

    private record Point(long timestampMs, double slippageBps, double executionQualityScore) {
    }
}
