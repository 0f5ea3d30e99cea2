package com.volsignal.core.model;

/**
 * Named composite verdicts, strongest first within each cascade.
 *
 * <p>The non-intraday cascade produces the bullish "fear bounce" family plus the
 * group-driven verdicts; the intraday cascade produces only the bearish pair.
 */
public enum CompositeSignal {

    /** Three or more groups firing at once. */
    MULTI_SIGNAL_STRONG(Direction.BULLISH),

    /** Enough core fear signals firing (3, or 4 during vixpiration). */
    FEAR_BOUNCE_STRONG(Direction.BULLISH),

    /** Strong core fear inside the OpEx window. */
    FEAR_BOUNCE_STRONG_OPEX(Direction.BULLISH),

    /** Both funding signals plus another group. */
    FUNDING_STRESS(Direction.BULLISH),

    /** Both wing-skew signals plus another group. */
    WING_PANIC(Direction.BULLISH),

    /** Two or more vol-momentum signals plus another group. */
    VOL_ACCELERATION(Direction.BULLISH),

    /** Two core fear signals only. */
    FEAR_BOUNCE_LONG(Direction.BULLISH),

    /** Intraday: broad or deep fear read as continued selling. */
    DIRECTIONAL_BEARISH(Direction.BEARISH),

    /** Intraday: weaker bearish read. */
    DIRECTIONAL_BEARISH_WEAK(Direction.BEARISH);

    public enum Direction { BULLISH, BEARISH }

    private final Direction direction;

    CompositeSignal(Direction direction) {
        this.direction = direction;
    }

    public Direction direction() {
        return direction;
    }

    public boolean isBearish() {
        return direction == Direction.BEARISH;
    }
}
