package borg.screenmatch.templatematching;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import borg.screenmatch.raster.IntegralImage;
import borg.screenmatch.raster.NormalizedRaster;
import borg.screenmatch.raster.RasterImage;
import borg.screenmatch.raster.RasterNormalizer;
import borg.screenmatch.worker.DynamicWorkerPool;
import borg.screenmatch.worker.Task;

/**
 * Searches templates in one scan at a time using a {@link DynamicWorkerPool}. The first window accepted by
 * any worker wins. Which one that is among several true matches depends on thread timing.
 * <p>
 * The pool is kept between searches. Only one search runs at a time per matcher.
 */
public class TemplateMatcher {

	static final Logger logger = LoggerFactory.getLogger(TemplateMatcher.class);

	public static final int DEFAULT_INITIAL_WORKERS = 1;
	public static final int DEFAULT_QUEUE_CAPACITY = 3000;

	private final DynamicWorkerPool pool;
	private final ChunkPartitioner partitioner;
	private final ChunkDistribution distribution;
	private final FindOptions defaultOptions;
	private final AtomicInteger taskIds = new AtomicInteger();

	private RasterImage scan = null;
	private NormalizedRaster normalizedScan = null;
	private IntegralImage integralImage = null;

	public TemplateMatcher(RasterImage scan) {
		this(scan, new DynamicWorkerPool(DEFAULT_INITIAL_WORKERS, DEFAULT_QUEUE_CAPACITY), new ChunkPartitioner(ForkJoinPool.commonPool()), new AlternatingChunkDistribution(),
				new FindOptions());
	}

	public TemplateMatcher(RasterImage scan, DynamicWorkerPool pool, ChunkPartitioner partitioner, ChunkDistribution distribution, FindOptions defaultOptions) {
		this.scan = scan;
		this.pool = pool;
		this.partitioner = partitioner;
		this.distribution = distribution;
		this.defaultOptions = new FindOptions(defaultOptions);
	}

	public MatchResult findTemplate(RasterImage template) throws NoMatchFoundException, InterruptedException {
		return this.findTemplate(template, this.defaultOptions);
	}

	public MatchResult findTemplate(RasterImage template, double threshold, long timeoutMillis) throws NoMatchFoundException, InterruptedException {
		return this.findTemplate(template, new FindOptions(this.defaultOptions).withThreshold(threshold).withTimeoutMillis(timeoutMillis));
	}

	/**
	 * @return Top-left corner of the match relative to the scan
	 * @throws TemplateDimensionException
	 *             If the template is wider or higher than the scan. Nothing is scheduled in that case.
	 * @throws NoMatchFoundException
	 *             If no window was accepted before the timeout
	 */
	public synchronized MatchResult findTemplate(RasterImage template, FindOptions options) throws NoMatchFoundException, InterruptedException {
		if (this.scan == null) {
			throw new IllegalStateException("No scan set");
		}
		if (template.getWidth() > this.scan.getWidth() || template.getHeight() > this.scan.getHeight()) {
			throw new TemplateDimensionException(template.getWidth(), template.getHeight(), this.scan.getWidth(), this.scan.getHeight());
		}

		final long searchStart = System.currentTimeMillis();
		final SearchCancellation cancellation = SearchCancellation.withTimeout(options.getTimeoutMillis());
		try {
			// Scan data is prepared once per scan, on this thread, before any worker reads it
			if (this.normalizedScan == null) {
				this.normalizedScan = RasterNormalizer.normalize(this.scan);
				this.integralImage = IntegralImage.of(this.normalizedScan);
			}
			final PreparedTemplate prepared = PreparedTemplate.of(template);
			final SimilarityScorer scorer = new SimilarityScorer(prepared, this.normalizedScan, this.integralImage, options.getScoringMode(), options.getThreshold());

			final List<Chunk> chunks = this.partitioner.partition(this.normalizedScan, prepared.getWidth(), prepared.getHeight());
			final int numWorkers = Math.min(workerCount(), chunks.size());
			final List<List<Chunk>> chunkGroups = this.distribution.distribute(chunks, numWorkers);

			if (numWorkers > this.pool.getMaxWorkers()) {
				this.pool.increaseMaxWorkers(numWorkers - this.pool.getMaxWorkers());
			}
			this.pool.start();

			final AtomicBoolean matchFound = new AtomicBoolean(false);
			final BlockingQueue<MatchResult> resultSlot = new ArrayBlockingQueue<>(1);
			for (List<Chunk> chunkGroup : chunkGroups) {
				if (!chunkGroup.isEmpty()) {
					final int taskId = this.taskIds.incrementAndGet();
					this.pool.submitTask(new Task(taskId, "search-" + taskId, new ChunkGroupSearch(chunkGroup, scorer, matchFound, resultSlot, cancellation)));
				}
			}
			logger.debug("Submitted " + chunkGroups.size() + " task(s) over " + chunks.size() + " chunk(s) for " + prepared + ", " + options);

			final MatchResult result = resultSlot.poll(Math.max(0, cancellation.remainingNanos()), TimeUnit.NANOSECONDS);
			if (result == null) {
				logger.info(String.format(Locale.US, "No match for %s after %,d ms", prepared, System.currentTimeMillis() - searchStart));
				throw new NoMatchFoundException(options.getTimeoutMillis());
			}
			logger.info(String.format(Locale.US, "Matched %s at %s with score %.3f after %,d ms", prepared, result, result.getScore(), System.currentTimeMillis() - searchStart));
			return result;
		} finally {
			cancellation.cancel();
			this.pool.clearTaskQueue();
		}
	}

	/**
	 * Replaces the scan. Running searches are stopped and waited for first, so no worker reads the old data
	 * after this returns.
	 */
	public synchronized void setScan(RasterImage scan) throws InterruptedException {
		this.pool.clearTaskQueue();
		this.pool.stop();
		this.pool.await();

		this.scan = scan;
		this.normalizedScan = null;
		this.integralImage = null;
		this.pool.start();
	}

	public void shutdown() {
		this.pool.shutdown();
	}

	/**
	 * One worker per core, leaving one for the caller
	 */
	static int workerCount() {
		return Math.max(Runtime.getRuntime().availableProcessors() - 1, 1);
	}

	public synchronized RasterImage getScan() {
		return scan;
	}

	public DynamicWorkerPool getPool() {
		return pool;
	}

	public ChunkDistribution getDistribution() {
		return distribution;
	}

	public FindOptions getDefaultOptions() {
		return new FindOptions(this.defaultOptions);
	}

}
