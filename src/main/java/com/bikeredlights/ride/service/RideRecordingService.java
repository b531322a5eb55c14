package com.bikeredlights.ride.service;

import com.bikeredlights.ride.config.RideTrackingProperties;
import com.bikeredlights.ride.dto.response.RideSnapshotResponse;
import com.bikeredlights.ride.service.location.LocationSource;
import com.bikeredlights.ride.service.location.LocationUnavailableException;
import com.bikeredlights.ride.service.motion.BearingSmoother;
import com.bikeredlights.ride.service.motion.LocationFix;
import com.bikeredlights.ride.service.motion.LocationFixValidator;
import com.bikeredlights.ride.service.motion.SpeedEstimator;
import com.bikeredlights.ride.service.settings.RideSettingsProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * 라이드 기록 파사드 (단일 진입점).
 *
 * 흐름:
 *  1) 시작/fix/일시정지/재개/종료 요청을 RideStateMachine 에 순서대로 전달 (synchronized)
 *  2) 경로 포인트로 기록된 fix 는 즉시 저장소에 append
 *  3) 변경될 때마다 스냅샷과 일시정지 시작 시각을 sink 로 발행
 *  4) 종료 시 요약 저장 (너무 짧거나 fix 가 없던 라이드는 폐기)
 */
@Slf4j
@Service
public class RideRecordingService {

    private final RideStateMachine machine;
    private final RideSnapshotAssembler assembler;
    private final RideRepository repository;
    private final PauseTimer pauseTimer;
    private final RideTrackingProperties props;
    private final Clock clock;

    private final Sinks.Many<RideSnapshotResponse> snapshotSink = Sinks.many().replay().latest();
    private final Sinks.Many<Optional<Long>> pauseStartSink = Sinks.many().replay().latest();

    private Disposable locationSubscription;
    private boolean locationAvailable = true;

    public RideRecordingService(LocationFixValidator validator,
                                SpeedEstimator speedEstimator,
                                BearingSmoother bearingSmoother,
                                RideSettingsProvider settings,
                                RideSnapshotAssembler assembler,
                                RideRepository repository,
                                PauseTimer pauseTimer,
                                RideTrackingProperties props,
                                Clock clock) {
        this.machine = new RideStateMachine(validator, speedEstimator, bearingSmoother, settings, clock);
        this.assembler = assembler;
        this.repository = repository;
        this.pauseTimer = pauseTimer;
        this.props = props;
        this.clock = clock;
        pauseStartSink.emitNext(Optional.empty(), Sinks.EmitFailureHandler.FAIL_FAST);
    }

    public synchronized RideSnapshotResponse startRide() {
        machine.startRide();
        return publish();
    }

    public synchronized RideSnapshotResponse submitFix(LocationFix fix) {
        FixOutcome outcome = machine.onFix(fix);
        if (outcome == FixOutcome.RECORDED) {
            repository.appendFix(machine.getSession().getRideId(), fix);
        }
        if (outcome != FixOutcome.IGNORED) {
            locationAvailable = true;
        }
        return publish();
    }

    public synchronized RideSnapshotResponse pause() {
        machine.manualPause();
        return publish();
    }

    public synchronized RideSnapshotResponse resume() {
        machine.manualResume();
        return publish();
    }

    /**
     * 라이드 종료.
     *
     * @return 저장된 요약 (진행 중인 라이드가 없었거나 폐기되었으면 empty)
     */
    public synchronized Optional<RideSummary> stopRide() {
        RideSession finished = machine.stopRide();
        // 일시정지 타이머는 세션이 저장되기 전에 멈춘다
        publish();
        detach();

        if (finished == null) {
            return Optional.empty();
        }

        long elapsed = finished.getEndedAtMs() - finished.getStartedAtMs();
        if (finished.getPointCount() == 0 || elapsed < props.getMinRideDurationMs()) {
            repository.delete(finished.getRideId());
            log.info("[RIDE] 라이드 폐기 rideId={} points={} elapsedMs={} (최소 {}ms)",
                    finished.getRideId(), finished.getPointCount(), elapsed, props.getMinRideDurationMs());
            return Optional.empty();
        }

        RideSummary summary = RideSummary.from(finished);
        repository.saveSummary(summary);
        log.info("[RIDE] 라이드 저장 rideId={} distanceM={} avgKmh={}",
                summary.rideId(), Math.round(summary.distanceMeters()), summary.avgSpeedKmh());
        return Optional.of(summary);
    }

    public synchronized RideSnapshotResponse snapshot() {
        return assembler.assemble(machine.getSession(), locationAvailable, clock.millis());
    }

    public synchronized RideState getState() {
        return machine.getState();
    }

    /** 스냅샷 스트림 (구독 즉시 최신값 1개) */
    public Flux<RideSnapshotResponse> snapshots() {
        return snapshotSink.asFlux();
    }

    /**
     * 일시정지 경과 시간 스트림.
     * 일시정지가 끝나면 (시작 시각이 비면) 내부 interval 은 즉시 취소된다.
     */
    public Flux<Duration> pauseTimer() {
        return pauseStartSink.asFlux()
                .distinctUntilChanged()
                .switchMap(start -> start.map(pauseTimer::ticks).orElseGet(Flux::empty));
    }

    /**
     * 위치 소스 구독. 이전 구독은 해제한다.
     */
    public synchronized void attach(LocationSource source) {
        detach();
        locationAvailable = true;
        locationSubscription = source.fixes().subscribe(this::submitFix, this::onLocationError);
        log.info("[FIX] 위치 소스 연결");
    }

    public synchronized void detach() {
        if (locationSubscription != null) {
            locationSubscription.dispose();
            locationSubscription = null;
            log.info("[FIX] 위치 소스 해제");
        }
    }

    private synchronized void onLocationError(Throwable e) {
        locationAvailable = false;
        locationSubscription = null;
        if (e instanceof LocationUnavailableException) {
            log.warn("[FIX] 위치 사용 불가: {}", e.getMessage());
        } else {
            log.error("[FIX] 위치 소스 오류", e);
        }
        publish();
    }

    private RideSnapshotResponse publish() {
        RideSession session = machine.getSession();
        Long pauseStart = session != null ? session.getCurrentPauseStartMs() : null;
        pauseStartSink.emitNext(Optional.ofNullable(pauseStart), Sinks.EmitFailureHandler.FAIL_FAST);

        RideSnapshotResponse snapshot = assembler.assemble(session, locationAvailable, clock.millis());
        snapshotSink.emitNext(snapshot, Sinks.EmitFailureHandler.FAIL_FAST);
        return snapshot;
    }
}
