package com.bikeredlights.ride.service;

import com.bikeredlights.ride.service.motion.BearingEstimate;
import com.bikeredlights.ride.service.motion.BearingSmoother;
import com.bikeredlights.ride.service.motion.FixValidation;
import com.bikeredlights.ride.service.motion.LocationFix;
import com.bikeredlights.ride.service.motion.LocationFixValidator;
import com.bikeredlights.ride.service.motion.SpeedEstimator;
import com.bikeredlights.ride.service.motion.SpeedSample;
import com.bikeredlights.ride.service.settings.RideSettingsProvider;
import com.bikeredlights.ride.util.GeoUtils;
import com.bikeredlights.ride.util.RideNameGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.UUID;

/**
 * 라이드 기록 오케스트레이터.
 * - fix 검증 → 속도/방위각 추정 → 상태 전이 → 거리/시간 누적
 * - 세션(RideSession)을 단독 소유하고 수정한다
 * - 상태 전이는 RideTransitions 표를 통해서만 일어난다. 무효 이벤트는 로그만 남기고 무시
 *
 * 단일 스레드 사용을 전제로 한다 (동기화는 RideRecordingService 가 담당).
 */
@Slf4j
public class RideStateMachine {

    private final LocationFixValidator validator;
    private final SpeedEstimator speedEstimator;
    private final BearingSmoother bearingSmoother;
    private final RideSettingsProvider settings;
    private final Clock clock;

    private RideSession session;

    public RideStateMachine(LocationFixValidator validator,
                            SpeedEstimator speedEstimator,
                            BearingSmoother bearingSmoother,
                            RideSettingsProvider settings,
                            Clock clock) {
        this.validator = validator;
        this.speedEstimator = speedEstimator;
        this.bearingSmoother = bearingSmoother;
        this.settings = settings;
        this.clock = clock;
    }

    public RideState getState() {
        return session != null ? session.getState() : RideState.IDLE;
    }

    /** 진행 중인 세션 (없으면 null) */
    public RideSession getSession() {
        return session;
    }

    /**
     * IDLE → WAITING_FOR_FIX. 이미 라이드 중이면 무시.
     *
     * @return 새 라이드가 시작되었는지
     */
    public boolean startRide() {
        if (RideTransitions.next(getState(), RideEvent.START_RIDE) == null) {
            logIgnored(RideEvent.START_RIDE);
            return false;
        }
        long now = clock.millis();
        String rideId = UUID.randomUUID().toString();
        session = new RideSession(rideId,
                RideNameGenerator.defaultName(now, clock.getZone()),
                now,
                RideState.WAITING_FOR_FIX);
        log.info("[RIDE] 라이드 시작 rideId={} → {}", rideId, RideState.WAITING_FOR_FIX);
        return true;
    }

    public FixOutcome onFix(LocationFix raw) {
        if (session == null) {
            log.debug("[FIX] 진행 중인 라이드 없음, fix 무시");
            return FixOutcome.IGNORED;
        }

        LocationFix previous = session.getLastAcceptedFix();
        FixValidation v = validator.validate(raw, previous);
        if (!v.isAccepted()) {
            session.incrementRejectedFixCount();
            log.debug("[FIX] 거절 rideId={} reason={} ts={}", session.getRideId(), v.reason(), raw.timestampMs());
            return FixOutcome.REJECTED;
        }

        LocationFix fix = v.fix();
        SpeedSample sample = speedEstimator.estimate(fix, previous);
        BearingEstimate bearing = bearingSmoother.update(fix, previous, session.getBearing());

        session.setLastAcceptedFix(fix);
        session.setLastSpeed(sample);
        session.setBearing(bearing);

        long now = clock.millis();
        session.setLastFixReceivedAtMs(now);

        return switch (session.getState()) {
            case WAITING_FOR_FIX -> {
                fire(RideEvent.FIRST_VALID_FIX);
                session.totals().startMoving(now);
                recordPoint(fix, sample);
                trackStationaryRun(sample, now);
                yield FixOutcome.RECORDED;
            }
            case RECORDING -> {
                session.totals().tickMoving(now);
                recordPoint(fix, sample);
                trackStationaryRun(sample, now);
                yield FixOutcome.RECORDED;
            }
            case AUTO_PAUSED -> {
                if (sample.stationary()) {
                    yield FixOutcome.ACCEPTED;
                }
                fire(RideEvent.MOTION_RESUMED);
                endPause(now, true);
                session.totals().startMoving(now);
                session.setSegmentBreak(true);
                session.setStationaryRunStartMs(null);
                log.info("[PAUSE] 움직임 감지, 자동 재개 rideId={} speedKmh={}", session.getRideId(), sample.speedKmh());
                recordPoint(fix, sample);
                yield FixOutcome.RECORDED;
            }
            case MANUALLY_PAUSED -> FixOutcome.ACCEPTED;
            case IDLE -> FixOutcome.IGNORED;
        };
    }

    public boolean manualPause() {
        if (!fire(RideEvent.MANUAL_PAUSE)) return false;
        long now = clock.millis();
        session.totals().stopMoving(now);
        session.setStationaryRunStartMs(null);
        beginPause(now);
        return true;
    }

    public boolean manualResume() {
        if (!fire(RideEvent.MANUAL_RESUME)) return false;
        long now = clock.millis();
        endPause(now, false);
        session.totals().startMoving(now);
        session.setSegmentBreak(true);
        return true;
    }

    /**
     * 라이드 종료. 진행 중인 일시정지/이동 시간을 즉시 정산한 뒤 세션을 넘겨준다.
     *
     * @return 종료된 세션 (종료할 라이드가 없으면 null)
     */
    public RideSession stopRide() {
        RideState before = getState();
        if (!fire(RideEvent.STOP_RIDE)) return null;

        long now = clock.millis();
        if (before.isPaused()) {
            endPause(now, before == RideState.AUTO_PAUSED);
        }
        session.totals().stopMoving(now);
        session.setEndedAtMs(now);

        RideSession finished = session;
        session = null;
        log.info("[RIDE] 라이드 종료 rideId={} distanceM={} movingMs={} pausedMs={} points={}",
                finished.getRideId(),
                Math.round(finished.getMovingDistanceMeters()),
                finished.getMovingDurationMs(),
                finished.getPausedDurationMs(),
                finished.getPointCount());
        return finished;
    }

    // ------------------------------------------------------------------

    private boolean fire(RideEvent event) {
        RideState from = getState();
        RideState to = RideTransitions.next(from, event);
        if (to == null) {
            logIgnored(event);
            return false;
        }
        session.setState(to);
        log.info("[RIDE] {} --{}--> {} rideId={}", from, event, to, session.getRideId());
        return true;
    }

    private void logIgnored(RideEvent event) {
        log.info("[RIDE] 현재 상태 {} 에서 {} 이벤트는 무시합니다.", getState(), event);
    }

    private void recordPoint(LocationFix fix, SpeedSample sample) {
        LocationFix last = session.getLastPoint();
        if (last != null && !session.isSegmentBreak()) {
            double d = GeoUtils.haversine(last.latitude(), last.longitude(), fix.latitude(), fix.longitude());
            session.totals().addDistance(d);
        }
        session.setSegmentBreak(false);
        session.appendPoint(fix);

        if (sample.speedKmh() > session.getMaxSpeedKmh()) {
            session.setMaxSpeedKmh(sample.speedKmh());
        }
    }

    // 연속 정지 샘플 구간이 임계값 이상 지속되면 자동 일시정지
    private void trackStationaryRun(SpeedSample sample, long now) {
        if (!sample.stationary()) {
            session.setStationaryRunStartMs(null);
            return;
        }
        if (session.getStationaryRunStartMs() == null) {
            session.setStationaryRunStartMs(sample.timestampMs());
        }
        if (!settings.isAutoPauseEnabled()) {
            return;
        }

        long thresholdMs = settings.getAutoPauseThresholdSeconds() * 1000L;
        long runMs = sample.timestampMs() - session.getStationaryRunStartMs();
        if (runMs >= thresholdMs && fire(RideEvent.STATIONARY_THRESHOLD_REACHED)) {
            session.totals().stopMoving(now);
            beginPause(now);
            log.info("[PAUSE] 정지 {}ms 지속 (임계 {}ms), 자동 일시정지 rideId={}",
                    runMs, thresholdMs, session.getRideId());
        }
    }

    private void beginPause(long now) {
        session.setCurrentPauseStartMs(now);
    }

    private void endPause(long now, boolean auto) {
        Long start = session.getCurrentPauseStartMs();
        if (start != null) {
            session.totals().addPause(Math.max(0L, now - start), auto);
        }
        session.setCurrentPauseStartMs(null);
    }
}
