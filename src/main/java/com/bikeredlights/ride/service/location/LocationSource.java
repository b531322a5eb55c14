package com.bikeredlights.ride.service.location;

import com.bikeredlights.ride.service.motion.LocationFix;
import reactor.core.publisher.Flux;

/**
 * 위치 fix 공급원 (~1Hz).
 * 권한 없음/프로바이더 꺼짐은 LocationUnavailableException 으로 onError.
 * 한동안 fix 가 오지 않는 것은 오류가 아니다.
 */
public interface LocationSource {

    Flux<LocationFix> fixes();
}
