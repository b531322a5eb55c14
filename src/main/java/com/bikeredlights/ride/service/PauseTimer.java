package com.bikeredlights.ride.service;

import com.bikeredlights.ride.config.RideTrackingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;

/**
 * 일시정지 경과 시간 타이머.
 * 매 틱마다 저장된 시작 시각으로부터 다시 계산한다 (틱 횟수를 세지 않음).
 */
@Component
@RequiredArgsConstructor
public class PauseTimer {

    private final Clock clock;
    private final RideTrackingProperties props;

    /**
     * 구독 즉시 한 번, 이후 pauseTickMs 간격으로 경과 시간을 내보낸다.
     * 구독 해제(일시정지 종료)와 함께 멈춘다.
     */
    public Flux<Duration> ticks(long pauseStartMs) {
        return Flux.interval(Duration.ZERO, Duration.ofMillis(props.getPauseTickMs()))
                .map(i -> Duration.ofMillis(Math.max(0L, clock.millis() - pauseStartMs)));
    }

    /** 화면 표시용: m:ss, 1시간 이상이면 h:mm:ss */
    public static String format(Duration elapsed) {
        long total = Math.max(0L, elapsed.getSeconds());
        long h = total / 3600;
        long m = (total % 3600) / 60;
        long s = total % 60;
        if (h > 0) {
            return String.format("%d:%02d:%02d", h, m, s);
        }
        return String.format("%d:%02d", m, s);
    }
}
