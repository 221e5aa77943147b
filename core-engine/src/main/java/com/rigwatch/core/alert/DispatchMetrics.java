package com.rigwatch.core.alert;

/**
 * Counters the {@link AlertDispatcher} reports to.
 */
public interface DispatchMetrics {

    DispatchMetrics NOOP = new DispatchMetrics() {
        @Override
        public void onAlertDispatched() {
        }

        @Override
        public void onDuplicateSuppressed() {
        }

        @Override
        public void onSinkFailure(SinkDeliveryException failure) {
        }
    };

    void onAlertDispatched();

    void onDuplicateSuppressed();

    void onSinkFailure(SinkDeliveryException failure);
}
