package com.volsignal.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The 19 signals produced on every evaluation.
 *
 * <p>Declaration order is the dashboard order and the order in which firing
 * tier-1 keys are reported.
 */
public enum SignalKey {

    // core fear
    SKEWING("skewing", "Skewing", SignalGroup.CORE, 1),
    RIP("rip", "Risk Implied Premium", SignalGroup.CORE, 1),
    SKEW_25D_RR("skew_25d_rr", "Skew (25d RR)", SignalGroup.CORE, 1),
    CONTANGO("contango", "Contango", SignalGroup.CORE, 1),
    CREDIT_SPREAD("credit_spread", "Credit Spread (HYG-TLT)", SignalGroup.CORE, 1),

    // wing skew
    WING_SKEW_30D("wing_skew_30d", "Wing Skew 30d (95d-5d)", SignalGroup.WING, 1),
    WING_SKEW_10D("wing_skew_10d", "Wing Skew 10d (95d-5d)", SignalGroup.WING, 1),

    // funding stress
    BORROW_TERM("borrow_term", "Borrow Term (30d-2y)", SignalGroup.FUNDING, 1),
    BORROW_SPREAD("borrow_spread", "Borrow Spread (vs risk-free)", SignalGroup.FUNDING, 1),

    // vol momentum
    IV_MOMENTUM("iv_momentum", "IV30 1-day Change", SignalGroup.MOMENTUM, 1),
    SKEWING_CHANGE("skewing_change", "Skewing 1-day Change", SignalGroup.MOMENTUM, 1),
    CONTANGO_CHANGE("contango_change", "Contango 1-day Change", SignalGroup.MOMENTUM, 1),

    // secondary
    FBFWD30_20("fbfwd30_20", "Forecast (fbfwd30/20)", SignalGroup.SECONDARY, 2),
    RSLP30("rSlp30", "Skew Slope (rSlp30)", SignalGroup.SECONDARY, 2),
    FWD_KINK("fwd_kink", "Fwd Vol Kink", SignalGroup.SECONDARY, 3),
    RDRV30("rDrv30", "RV Derivative", SignalGroup.SECONDARY, 3),
    MODEL_CONFIDENCE("model_confidence", "Model Confidence", SignalGroup.SECONDARY, 2),
    MW_ADJ_30("mw_adj_30", "Market Width (mwAdj30)", SignalGroup.SECONDARY, 3),
    IV10_IV30_RATIO("iv10_iv30_ratio", "IV10/IV30 Ratio", SignalGroup.SECONDARY, 2);

    private final String key;
    private final String label;
    private final SignalGroup group;
    private final int tier;

    SignalKey(String key, String label, SignalGroup group, int tier) {
        this.key = key;
        this.label = label;
        this.group = group;
        this.tier = tier;
    }

    public String key()         { return key; }
    public String label()       { return label; }
    public SignalGroup group()  { return group; }
    public int tier()           { return tier; }

    public static List<SignalKey> ofGroup(SignalGroup group) {
        return Arrays.stream(values()).filter(k -> k.group == group).toList();
    }

    public static Optional<SignalKey> fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
    }
}
