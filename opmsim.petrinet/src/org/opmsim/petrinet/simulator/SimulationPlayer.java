package org.opmsim.petrinet.simulator;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.apache.log4j.Logger;
import org.opmsim.exceptions.NotEnabledException;

/**
 * Drives a simulator with a repeating tick. Each tick fires one transition; playback stops
 * by itself once nothing is enabled. Pausing keeps the marking as last computed.
 */
public class SimulationPlayer implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(SimulationPlayer.class);

    private final PetriNetSimulator simulator;
    private final TransitionSelector selector;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> ticking;

    public SimulationPlayer(PetriNetSimulator simulator) {
        this(simulator, TransitionSelector.LOWEST_ID);
    }

    public SimulationPlayer(PetriNetSimulator simulator, TransitionSelector selector) {
        this.simulator = simulator;
        this.selector = selector;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "simulation-player");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void play(long periodMillis) {
        if (periodMillis <= 0) {
            throw new IllegalArgumentException("Tick period must be positive: " + periodMillis);
        }
        if (isPlaying()) {
            return;
        }
        logger.info("Playback started, one step every " + periodMillis + " ms");
        ticking = scheduler.scheduleAtFixedRate(this::scheduledTick, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    public synchronized void pause() {
        if (ticking != null) {
            ticking.cancel(false);
            ticking = null;
            logger.info("Playback paused at " + simulator.getMarking());
        }
    }

    public synchronized boolean isPlaying() {
        return ticking != null;
    }

    /**
     * Fires one transition if any is enabled.
     *
     * @return false when nothing was enabled; playback is then stopped
     */
    public synchronized boolean tick() throws NotEnabledException {
        if (simulator.enabled().isEmpty()) {
            logger.info("No transition enabled, playback stops");
            pause();
            return false;
        }
        simulator.step(selector);
        return true;
    }

    private void scheduledTick() {
        try {
            tick();
        } catch (NotEnabledException | RuntimeException e) {
            logger.error("Simulation tick failed, stopping playback", e);
            pause();
        }
    }

    public PetriNetSimulator getSimulator() {
        return simulator;
    }

    @Override
    public void close() {
        pause();
        scheduler.shutdownNow();
    }
}
