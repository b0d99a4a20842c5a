package com.stablemint.schedule;

import com.stablemint.config.AppProps;
import com.stablemint.service.PositionMonitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;

/**
 * Ticks every minute; the service only runs when app.monitor.cron says it is due.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PositionMonitorScheduler {

    private final PositionMonitorService service;
    private final AppProps props;

    private ZonedDateTime nextRun;

    @Scheduled(cron = "0 * * * * ?") // every minute
    public void run() {
        if (!props.getMonitor().isEnabled()) return;
        ZonedDateTime now = ZonedDateTime.now();
        try {
            CronExpression expr = CronExpression.parse(props.getMonitor().getCron());
            if (nextRun == null) nextRun = expr.next(now.minusMinutes(1));
            if (nextRun != null && !nextRun.isAfter(now)) {
                log.info("[monitor-scheduler] polling positions at {}", now);
                service.pollPositions();
                nextRun = expr.next(now);
            } else {
                log.debug("[monitor-scheduler] skipping at {}, next run at {}", now, nextRun);
            }
        } catch (RuntimeException e) {
            log.error("[monitor-scheduler] run failed: {}", e.getMessage(), e);
        }
    }
}
