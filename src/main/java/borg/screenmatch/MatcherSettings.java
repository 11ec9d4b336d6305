package borg.screenmatch;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import borg.screenmatch.templatematching.AlternatingChunkDistribution;
import borg.screenmatch.templatematching.ChunkDistribution;
import borg.screenmatch.templatematching.FindOptions;
import borg.screenmatch.templatematching.ReversingRoundRobinDistribution;
import borg.screenmatch.templatematching.ScoringMode;
import borg.screenmatch.templatematching.TemplateMatcher;
import borg.screenmatch.worker.DynamicWorkerPool;

public class MatcherSettings {

	public static final String SETTINGS_FILENAME = "screen-matcher-settings.json";

	private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

	public enum Distribution {
		ALTERNATING, REVERSING_ROUND_ROBIN;

		public ChunkDistribution create() {
			return this == REVERSING_ROUND_ROBIN ? new ReversingRoundRobinDistribution() : new AlternatingChunkDistribution();
		}
	}

	private double defaultThreshold = FindOptions.DEFAULT_THRESHOLD;
	private long defaultTimeoutMillis = FindOptions.DEFAULT_TIMEOUT_MILLIS;
	private ScoringMode scoringMode = ScoringMode.PLAIN_MSE;
	private int initialWorkers = TemplateMatcher.DEFAULT_INITIAL_WORKERS;
	private int queueCapacity = TemplateMatcher.DEFAULT_QUEUE_CAPACITY;
	private long idleKeepAliveMillis = DynamicWorkerPool.DEFAULT_IDLE_KEEP_ALIVE_MILLIS;
	private boolean parallelPartitioning = true;
	private Distribution distribution = Distribution.ALTERNATING;

	/**
	 * Settings from the user's home directory, or defaults if there is no settings file yet
	 */
	public static MatcherSettings load() throws IOException {
		return load(new File(System.getProperty("user.home"), SETTINGS_FILENAME));
	}

	public static MatcherSettings load(File settingsFile) throws IOException {
		if (settingsFile.exists()) {
			try (InputStreamReader reader = new InputStreamReader(new BufferedInputStream(new FileInputStream(settingsFile)), StandardCharsets.UTF_8)) {
				MatcherSettings settings = gson.fromJson(reader, MatcherSettings.class);
				if (settings != null) {
					return settings;
				}
			}
		}
		return new MatcherSettings();
	}

	public static void save(MatcherSettings settings) throws IOException {
		save(settings, new File(System.getProperty("user.home"), SETTINGS_FILENAME));
	}

	public static void save(MatcherSettings settings, File settingsFile) throws IOException {
		try (OutputStreamWriter writer = new OutputStreamWriter(new BufferedOutputStream(new FileOutputStream(settingsFile)), StandardCharsets.UTF_8)) {
			gson.toJson(settings, writer);
		}
	}

	public FindOptions toFindOptions() {
		return new FindOptions().withThreshold(this.defaultThreshold).withTimeoutMillis(this.defaultTimeoutMillis).withScoringMode(this.scoringMode);
	}

	public double getDefaultThreshold() {
		return defaultThreshold;
	}

	public void setDefaultThreshold(double defaultThreshold) {
		this.defaultThreshold = defaultThreshold;
	}

	public long getDefaultTimeoutMillis() {
		return defaultTimeoutMillis;
	}

	public void setDefaultTimeoutMillis(long defaultTimeoutMillis) {
		this.defaultTimeoutMillis = defaultTimeoutMillis;
	}

	public ScoringMode getScoringMode() {
		return scoringMode;
	}

	public void setScoringMode(ScoringMode scoringMode) {
		this.scoringMode = scoringMode;
	}

	public int getInitialWorkers() {
		return initialWorkers;
	}

	public void setInitialWorkers(int initialWorkers) {
		this.initialWorkers = initialWorkers;
	}

	public int getQueueCapacity() {
		return queueCapacity;
	}

	public void setQueueCapacity(int queueCapacity) {
		this.queueCapacity = queueCapacity;
	}

	public long getIdleKeepAliveMillis() {
		return idleKeepAliveMillis;
	}

	public void setIdleKeepAliveMillis(long idleKeepAliveMillis) {
		this.idleKeepAliveMillis = idleKeepAliveMillis;
	}

	public boolean isParallelPartitioning() {
		return parallelPartitioning;
	}

	public void setParallelPartitioning(boolean parallelPartitioning) {
		this.parallelPartitioning = parallelPartitioning;
	}

	public Distribution getDistribution() {
		return distribution;
	}

	public void setDistribution(Distribution distribution) {
		this.distribution = distribution;
	}

}
