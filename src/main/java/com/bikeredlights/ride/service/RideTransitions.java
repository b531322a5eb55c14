package com.bikeredlights.ride.service;

/**
 * 라이드 상태 전이표.
 *
 * <pre>
 * IDLE            --START_RIDE-->                   WAITING_FOR_FIX
 * WAITING_FOR_FIX --FIRST_VALID_FIX-->              RECORDING
 * RECORDING       --MANUAL_PAUSE-->                 MANUALLY_PAUSED
 * RECORDING       --STATIONARY_THRESHOLD_REACHED--> AUTO_PAUSED
 * MANUALLY_PAUSED --MANUAL_RESUME-->                RECORDING
 * AUTO_PAUSED     --MOTION_RESUMED-->               RECORDING
 * (IDLE 제외 전부) --STOP_RIDE-->                    IDLE
 * </pre>
 *
 * 그 외 조합은 null (무시).
 */
public final class RideTransitions {
    private RideTransitions() {}

    public static RideState next(RideState state, RideEvent event) {
        return switch (state) {
            case IDLE -> event == RideEvent.START_RIDE ? RideState.WAITING_FOR_FIX : null;
            case WAITING_FOR_FIX -> switch (event) {
                case FIRST_VALID_FIX -> RideState.RECORDING;
                case STOP_RIDE -> RideState.IDLE;
                default -> null;
            };
            case RECORDING -> switch (event) {
                case MANUAL_PAUSE -> RideState.MANUALLY_PAUSED;
                case STATIONARY_THRESHOLD_REACHED -> RideState.AUTO_PAUSED;
                case STOP_RIDE -> RideState.IDLE;
                default -> null;
            };
            case MANUALLY_PAUSED -> switch (event) {
                case MANUAL_RESUME -> RideState.RECORDING;
                case STOP_RIDE -> RideState.IDLE;
                default -> null;
            };
            case AUTO_PAUSED -> switch (event) {
                case MOTION_RESUMED -> RideState.RECORDING;
                case STOP_RIDE -> RideState.IDLE;
                default -> null;
            };
        };
    }
}
