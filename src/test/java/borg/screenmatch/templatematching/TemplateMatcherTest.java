package borg.screenmatch.templatematching;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import borg.screenmatch.raster.Canvas;
import borg.screenmatch.raster.Orientation;
import borg.screenmatch.raster.RasterImage;
import borg.screenmatch.worker.DynamicWorkerPool;

public class TemplateMatcherTest {

	private static final Duration TIMEOUT = Duration.ofSeconds(20);

	private final List<TemplateMatcher> matchers = new ArrayList<>();

	@AfterEach
	public void shutdownMatchers() {
		for (TemplateMatcher matcher : this.matchers) {
			matcher.shutdown();
		}
	}

	private TemplateMatcher matcher(RasterImage scan) {
		TemplateMatcher matcher = new TemplateMatcher(scan);
		this.matchers.add(matcher);
		return matcher;
	}

	private static Canvas squareScan() {
		return new Canvas(100, 100).fill(40, 40, 10, 10, 255, 255, 255);
	}

	@Test
	public void findsWhiteSquareOnBlack() {
		TemplateMatcher matcher = this.matcher(squareScan().toRaster());
		RasterImage template = new Canvas(10, 10).fill(0, 0, 10, 10, 255, 255, 255).toRaster();

		MatchResult result = assertTimeoutPreemptively(TIMEOUT, () -> matcher.findTemplate(template, 50, 1000));

		assertEquals(40, result.getX());
		assertEquals(40, result.getY());
		assertEquals(0.0, result.getScore(), 0.0);
	}

	@Test
	public void grayTemplateTimesOut() {
		TemplateMatcher matcher = this.matcher(squareScan().toRaster());
		RasterImage template = new Canvas(10, 10).fill(0, 0, 10, 10, 128, 128, 128).toRaster();

		final long start = System.currentTimeMillis();
		NoMatchFoundException e = assertTimeoutPreemptively(TIMEOUT, () -> assertThrows(NoMatchFoundException.class, () -> matcher.findTemplate(template, 1, 1000)));
		final long elapsed = System.currentTimeMillis() - start;

		assertEquals(1000, e.getTimeoutMillis());
		assertTrue(elapsed >= 950, "gave up after " + elapsed + " ms");
		assertTrue(elapsed < 3000, "gave up after " + elapsed + " ms");
	}

	@Test
	public void findsExactCropOfNoise() {
		Canvas scan = new Canvas(200, 150).noise(1, 0, 255);
		TemplateMatcher matcher = this.matcher(scan.toRaster());

		MatchResult result = assertTimeoutPreemptively(TIMEOUT, () -> matcher.findTemplate(scan.crop(123, 77, 20, 15).toRaster(), 0.5, 5000));

		assertEquals(new MatchResult(123, 77, 0), result);
	}

	@Test
	public void encodingOfScanAndTemplateDoesNotMatter() {
		Canvas scan = new Canvas(160, 120).noise(2, 0, 255);
		TemplateMatcher matcher = this.matcher(scan.toRaster(32, Orientation.BOTTOM_UP));

		MatchResult result = assertTimeoutPreemptively(TIMEOUT, () -> matcher.findTemplate(scan.crop(3, 99, 17, 21).toRaster(), 0.5, 5000));

		assertEquals(3, result.getX());
		assertEquals(99, result.getY());
	}

	@Test
	public void thresholdIsInclusive() {
		Canvas scan = new Canvas(120, 90).noise(3, 20, 200);
		RasterImage template = scan.crop(60, 30, 12, 12).offset(4).toRaster();
		TemplateMatcher matcher = this.matcher(scan.toRaster());

		assertTimeoutPreemptively(TIMEOUT, () -> {
			assertThrows(NoMatchFoundException.class, () -> matcher.findTemplate(template, 15.9, 500));
			MatchResult result = matcher.findTemplate(template, 16, 5000);
			assertEquals(new MatchResult(60, 30, 16), result);
			assertEquals(16.0, result.getScore(), 1e-9);
		});
	}

	@Test
	public void oversizedTemplateSchedulesNothing() {
		DynamicWorkerPool pool = new DynamicWorkerPool(1, 100);
		TemplateMatcher matcher = new TemplateMatcher(new Canvas(50, 40).toRaster(), pool, new ChunkPartitioner(), new AlternatingChunkDistribution(), new FindOptions());
		this.matchers.add(matcher);

		assertThrows(TemplateDimensionException.class, () -> matcher.findTemplate(new Canvas(51, 10).toRaster()));
		assertThrows(TemplateDimensionException.class, () -> matcher.findTemplate(new Canvas(10, 41).toRaster()));
		assertEquals(0, pool.getSubmittedTaskCount());
	}

	@Test
	public void timeoutIsHonouredOnLargeScan() {
		Canvas scan = new Canvas(400, 300).noise(4, 0, 255);
		RasterImage template = new Canvas(30, 30).noise(5, 0, 255).toRaster();
		TemplateMatcher matcher = this.matcher(scan.toRaster());

		assertTimeoutPreemptively(TIMEOUT, () -> {
			final long start = System.currentTimeMillis();
			assertThrows(NoMatchFoundException.class, () -> matcher.findTemplate(template, 10, 300));
			final long elapsed = System.currentTimeMillis() - start;
			assertTrue(elapsed >= 290, "gave up after " + elapsed + " ms");
			assertTrue(elapsed < 3000, "gave up after " + elapsed + " ms");

			// Cancelled tasks leave the pool promptly
			matcher.getPool().await();
		});
	}

	@Test
	public void poolDrainsAfterMatch() {
		Canvas scan = new Canvas(300, 200).noise(6, 0, 255);
		TemplateMatcher matcher = this.matcher(scan.toRaster());

		assertTimeoutPreemptively(TIMEOUT, () -> {
			matcher.findTemplate(scan.crop(5, 5, 10, 10).toRaster(), 0.5, 5000);
			matcher.getPool().await();
		});

		assertEquals(0, matcher.getPool().getQueuedTaskCount());
	}

	@Test
	public void findsInReplacedScan() {
		Canvas first = new Canvas(80, 80).noise(7, 0, 255);
		Canvas second = new Canvas(80, 80).noise(8, 0, 255);
		Canvas template = new Canvas(9, 9).noise(9, 0, 255);
		first.paste(template, 10, 20);
		second.paste(template, 55, 61);
		TemplateMatcher matcher = this.matcher(first.toRaster());

		assertTimeoutPreemptively(TIMEOUT, () -> {
			assertEquals(new MatchResult(10, 20, 0), matcher.findTemplate(template.toRaster(), 0.5, 5000));
			matcher.setScan(second.toRaster());
			assertEquals(new MatchResult(55, 61, 0), matcher.findTemplate(template.toRaster(), 0.5, 5000));
		});
	}

	@Test
	public void normalizedScoring() {
		Canvas scan = new Canvas(90, 70).noise(10, 10, 250);
		RasterImage template = scan.crop(33, 44, 11, 11).toRaster();
		TemplateMatcher matcher = this.matcher(scan.toRaster());

		MatchResult result = assertTimeoutPreemptively(TIMEOUT,
				() -> matcher.findTemplate(template, new FindOptions().withScoringMode(ScoringMode.NORMALIZED).withThreshold(0.001).withTimeoutMillis(5000)));

		assertEquals(new MatchResult(33, 44, 0), result);
	}

	@Test
	public void reversingDistributionFindsTheSameMatch() {
		Canvas scan = new Canvas(150, 150).noise(12, 0, 255);
		TemplateMatcher matcher = new TemplateMatcher(scan.toRaster(), new DynamicWorkerPool(2, 100), new ChunkPartitioner(), new ReversingRoundRobinDistribution(),
				new FindOptions().withTimeoutMillis(5000).withThreshold(0.5));
		this.matchers.add(matcher);

		MatchResult result = assertTimeoutPreemptively(TIMEOUT, () -> matcher.findTemplate(scan.crop(140, 0, 10, 10).toRaster()));

		assertEquals(new MatchResult(140, 0, 0), result);
	}

	@Test
	public void searchWithoutScanIsRejected() {
		TemplateMatcher matcher = this.matcher(null);

		assertThrows(IllegalStateException.class, () -> matcher.findTemplate(new Canvas(5, 5).toRaster()));
	}

	@Test
	public void optionsAreValidated() {
		assertThrows(IllegalArgumentException.class, () -> new FindOptions().withThreshold(-1));
		assertThrows(IllegalArgumentException.class, () -> new FindOptions().withThreshold(Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> new FindOptions().withTimeoutMillis(0));
		assertThrows(IllegalArgumentException.class, () -> new FindOptions().withScoringMode(null));

		FindOptions defaults = new FindOptions();
		assertEquals(FindOptions.DEFAULT_THRESHOLD, defaults.getThreshold(), 0.0);
		assertEquals(FindOptions.DEFAULT_TIMEOUT_MILLIS, defaults.getTimeoutMillis());
		assertEquals(ScoringMode.PLAIN_MSE, defaults.getScoringMode());
	}

}
