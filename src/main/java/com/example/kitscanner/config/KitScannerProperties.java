package com.example.kitscanner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "kit-scanner")
public class KitScannerProperties {

    private final Checkout checkout = new Checkout();
    private final Checkin checkin = new Checkin();
    private final Scan scan = new Scan();
    private final Detection detection = new Detection();
    private final Storage storage = new Storage();
    private final History history = new History();

    public Checkout getCheckout() {
        return checkout;
    }

    public Checkin getCheckin() {
        return checkin;
    }

    public Scan getScan() {
        return scan;
    }

    public Detection getDetection() {
        return detection;
    }

    public Storage getStorage() {
        return storage;
    }

    public History getHistory() {
        return history;
    }

    public static class Checkout {

        /**
         * Hold a completed user/kit pair for confirmation instead of saving it straight away.
         */
        private boolean reviewEnabled = true;

        public boolean isReviewEnabled() {
            return reviewEnabled;
        }

        public void setReviewEnabled(boolean reviewEnabled) {
            this.reviewEnabled = reviewEnabled;
        }
    }

    public static class Checkin {

        /**
         * Pair a user id with the kit on check-in. When off, a single kit scan completes the check-in.
         */
        private boolean requireUser = false;

        public boolean isRequireUser() {
            return requireUser;
        }

        public void setRequireUser(boolean requireUser) {
            this.requireUser = requireUser;
        }
    }

    public static class Scan {

        /**
         * Time between feedback for a scan and the station accepting the next one.
         */
        private Duration settleDelay = Duration.ofMillis(1500);

        /**
         * How long the undo action stays available after a save.
         */
        private Duration undoTimeout = Duration.ofSeconds(10);

        public Duration getSettleDelay() {
            return settleDelay;
        }

        public void setSettleDelay(Duration settleDelay) {
            this.settleDelay = settleDelay;
        }

        public Duration getUndoTimeout() {
            return undoTimeout;
        }

        public void setUndoTimeout(Duration undoTimeout) {
            this.undoTimeout = undoTimeout;
        }
    }

    public static class Detection {

        private double highThreshold = 0.95;
        private double mediumThreshold = 0.80;

        public double getHighThreshold() {
            return highThreshold;
        }

        public void setHighThreshold(double highThreshold) {
            this.highThreshold = highThreshold;
        }

        public double getMediumThreshold() {
            return mediumThreshold;
        }

        public void setMediumThreshold(double mediumThreshold) {
            this.mediumThreshold = mediumThreshold;
        }
    }

    public static class Storage {

        private String directory = "./data";

        /**
         * Optional station location appended to record file names.
         */
        private String locationId;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getLocationId() {
            return locationId;
        }

        public void setLocationId(String locationId) {
            this.locationId = locationId;
        }
    }

    public static class History {

        private int maxSize = 50;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }
    }
}
