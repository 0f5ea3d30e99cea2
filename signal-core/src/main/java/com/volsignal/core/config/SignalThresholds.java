package com.volsignal.core.config;

import com.volsignal.core.exception.SignalEngineException;

/**
 * Thresholds for the 19 signals. Each signal compares one derived value against
 * one of these; the operator is fixed per signal (see {@code SignalCalculator}).
 *
 * <p>Wing, funding and momentum defaults sit at the P75–P90 of their historical
 * distributions.
 */
public record SignalThresholds(
    // core fear
    double skewingThresh,
    double ripThresh,
    double skewChangeThresh,
    double contangoDropThresh,
    double creditThresh,
    // wing skew
    double wingSkew30dThresh,
    double wingSkew10dThresh,
    // funding stress
    double borrowTermThresh,
    double borrowSpreadThresh,
    // vol momentum
    double ivMomentumThresh,
    double skewingChangeThresh,
    double contangoChangeThresh,
    // secondary
    double fbfwdHigh,
    double fbfwdLow,
    double slopeChangeThresh,
    double fwdKinkThresh,
    double rdrvRiseThresh,
    double ivFlatThresh,
    double modelConfidenceThresh,
    double mwAdjThresh,
    double iv10Iv30Thresh
) {
    public SignalThresholds {
        if (fbfwdLow > fbfwdHigh) {
            throw new SignalEngineException("SignalThresholds",
                "fbfwdLow " + fbfwdLow + " above fbfwdHigh " + fbfwdHigh);
        }
        if (contangoDropThresh < 0 || skewChangeThresh < 0 || slopeChangeThresh < 0) {
            throw new SignalEngineException("SignalThresholds",
                "change thresholds are magnitudes and must be non-negative");
        }
    }

    public static SignalThresholds defaults() {
        return new SignalThresholds(
            0.05,    // skewing
            70.0,    // rip
            0.010,   // 25d risk-reversal change vs baseline
            0.50,    // contango drop vs baseline (fraction)
            -0.005,  // credit spread
            0.19,    // dlt95-dlt5 30d (P90)
            0.16,    // dlt95-dlt5 10d (P90)
            0.0075,  // borrow30 - borrow2y (P75)
            0.042,   // borrow30 - riskFree30 (P85)
            0.005,   // 1-day iv30d increase
            0.02,    // 1-day skewing jump
            -0.03,   // 1-day contango drop
            1.05,
            0.95,
            0.3,
            0.01,
            0.01,
            0.005,
            0.97,    // below = model dislocation
            0.001,   // above = wide markets
            1.05     // above = short-term fear
        );
    }
}
