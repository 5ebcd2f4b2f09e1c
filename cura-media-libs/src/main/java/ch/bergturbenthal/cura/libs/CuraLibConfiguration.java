package ch.bergturbenthal.cura.libs;

import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.AsyncService;
import ch.bergturbenthal.cura.libs.service.impl.ExecutorAsyncService;
import ch.bergturbenthal.cura.libs.service.impl.FileThumbnailCache;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(MediaProperties.class)
@ComponentScan(basePackageClasses = FileThumbnailCache.class)
@Slf4j
public class CuraLibConfiguration {

    @Bean
    public AsyncService asyncService(final MediaProperties properties, Optional<MeterRegistry> meterRegistry) {
        final int threadCount = Math.max(1, properties.getWorkerThreads());
        log.info("Starting {} media worker threads", threadCount);
        final CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("media-worker-");
        threadFactory.setDaemon(true);
        final LinkedBlockingQueue<Runnable> workQueue = new LinkedBlockingQueue<>();
        final ThreadPoolExecutor executor = new ThreadPoolExecutor(threadCount, threadCount,
                Duration.ofMinutes(1).toMillis(), TimeUnit.MILLISECONDS, workQueue, threadFactory);

        return new ExecutorAsyncService(executor, meterRegistry);
    }
}
