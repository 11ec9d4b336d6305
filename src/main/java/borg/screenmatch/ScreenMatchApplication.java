package borg.screenmatch;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Robot;
import java.io.IOException;
import java.util.concurrent.ForkJoinPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import borg.screenmatch.session.RobotScreenCapturer;
import borg.screenmatch.session.ScanSession;
import borg.screenmatch.session.ScreenCapturer;
import borg.screenmatch.templatematching.ChunkPartitioner;
import borg.screenmatch.templatematching.TemplateMatcher;
import borg.screenmatch.worker.DynamicWorkerPool;

/**
 * Wiring of the matcher and its collaborators. Everything touching the screen is lazy, so the matcher can be
 * used without a display.
 */
@Configuration
public class ScreenMatchApplication {

	static final Logger logger = LoggerFactory.getLogger(ScreenMatchApplication.class);

	@Bean
	public MatcherSettings matcherSettings() {
		try {
			return MatcherSettings.load();
		} catch (IOException e) {
			logger.warn("Failed to read " + MatcherSettings.SETTINGS_FILENAME + ", using defaults", e);
			return new MatcherSettings();
		}
	}

	@Bean(destroyMethod = "shutdown")
	public TemplateMatcher templateMatcher(MatcherSettings settings) {
		DynamicWorkerPool pool = new DynamicWorkerPool(settings.getInitialWorkers(), settings.getQueueCapacity(), settings.getIdleKeepAliveMillis());
		ChunkPartitioner partitioner = new ChunkPartitioner(settings.isParallelPartitioning() ? ForkJoinPool.commonPool() : null);
		logger.debug("Creating template matcher with " + settings.getDistribution() + " distribution and " + settings.toFindOptions());
		return new TemplateMatcher(null, pool, partitioner, settings.getDistribution().create(), settings.toFindOptions());
	}

	@Bean
	@Lazy
	public Robot robot() {
		try {
			return new Robot(GraphicsEnvironment.getLocalGraphicsEnvironment().getDefaultScreenDevice());
		} catch (AWTException e) {
			throw new RuntimeException("Failed to obtain a robot", e);
		}
	}

	@Bean
	@Lazy
	public ScreenCapturer screenCapturer(Robot robot) {
		return new RobotScreenCapturer(robot);
	}

	@Bean
	@Lazy
	public ScanSession scanSession(ScreenCapturer screenCapturer, TemplateMatcher templateMatcher) {
		return new ScanSession(screenCapturer, templateMatcher);
	}

}
