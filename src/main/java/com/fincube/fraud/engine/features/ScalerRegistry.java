package com.fincube.fraud.engine.features;

import com.fincube.fraud.model.Scaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the current normalization scaler. Readers take a snapshot with
 * {@link #current()} and never block. Fits are serialized and draw strictly
 * increasing versions; a fitted scaler only becomes visible once published,
 * so in-flight requests keep the version they captured.
 */
@Component
public class ScalerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScalerRegistry.class);

    private final AtomicReference<Scaler> current = new AtomicReference<>();
    private final ReentrantLock fitLock = new ReentrantLock();
    private long lastVersion;

    public Optional<Scaler> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Fits a scaler over the batch under the next version without publishing it.
     */
    public Scaler fit(List<double[]> batch) {
        fitLock.lock();
        try {
            Scaler fitted = FeatureVectorBuilder.fit(batch, lastVersion + 1);
            lastVersion = fitted.getVersion();
            log.info("Fitted scaler v{} on {} vectors (dimension {})",
                    fitted.getVersion(), fitted.getSampleCount(), fitted.getDimension());
            return fitted;
        } finally {
            fitLock.unlock();
        }
    }

    /**
     * Makes a fitted scaler current. Ignored when an equal or newer version is
     * already published.
     */
    public boolean publish(Scaler scaler) {
        fitLock.lock();
        try {
            Scaler previous = current.get();
            if (previous != null && previous.getVersion() >= scaler.getVersion()) {
                return false;
            }
            current.set(scaler);
            lastVersion = Math.max(lastVersion, scaler.getVersion());
            log.info("Published scaler v{}", scaler.getVersion());
            return true;
        } finally {
            fitLock.unlock();
        }
    }

    /**
     * Restores a previously persisted scaler. Ignored when an equal or newer
     * version is already published.
     */
    public boolean restore(Scaler scaler) {
        fitLock.lock();
        try {
            Scaler previous = current.get();
            if (previous != null && previous.getVersion() >= scaler.getVersion()) {
                return false;
            }
            current.set(scaler);
            lastVersion = Math.max(lastVersion, scaler.getVersion());
            log.info("Restored scaler v{} ({} samples)", scaler.getVersion(), scaler.getSampleCount());
            return true;
        } finally {
            fitLock.unlock();
        }
    }
}
