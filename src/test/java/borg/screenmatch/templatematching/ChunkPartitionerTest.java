package borg.screenmatch.templatematching;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;

import boofcv.struct.image.InterleavedU8;
import borg.screenmatch.raster.Canvas;
import borg.screenmatch.raster.NormalizedRaster;
import borg.screenmatch.raster.RasterNormalizer;

public class ChunkPartitionerTest {

	private static NormalizedRaster scan(int width, int height) {
		return RasterNormalizer.normalize(new Canvas(width, height).noise(width * 31 + height, 0, 255).toRaster());
	}

	@Test
	public void everyWindowLiesInsideSomeChunk() throws InterruptedException {
		int[][] cases = { { 100, 100, 10, 10 }, { 640, 480, 37, 23 }, { 50, 30, 50, 30 }, { 61, 17, 1, 1 }, { 300, 40, 12, 39 }, { 200, 200, 33, 7 } };
		ChunkPartitioner partitioner = new ChunkPartitioner();

		for (int[] c : cases) {
			final int tw = c[2];
			final int th = c[3];
			List<Chunk> chunks = partitioner.partition(scan(c[0], c[1]), tw, th);

			for (int y = 0; y <= c[1] - th; y++) {
				for (int x = 0; x <= c[0] - tw; x++) {
					if (!covered(chunks, x, y, tw, th)) {
						fail("Window " + x + "/" + y + " of " + tw + "x" + th + " in " + c[0] + "x" + c[1] + " is not covered");
					}
				}
			}
			for (Chunk chunk : chunks) {
				assertTrue(chunk.getWidth() >= tw && chunk.getHeight() >= th, "chunk " + chunk + " smaller than template");
				assertTrue(chunk.getOriginX() + chunk.getWidth() <= c[0] && chunk.getOriginY() + chunk.getHeight() <= c[1], "chunk " + chunk + " outside scan");
			}
		}
	}

	private static boolean covered(List<Chunk> chunks, int x, int y, int tw, int th) {
		for (Chunk chunk : chunks) {
			if (chunk.containsWindow(x, y, tw, th)) {
				return true;
			}
		}
		return false;
	}

	@Test
	public void chunkSizeGrowsWithRatio() {
		assertEquals(25, ChunkPartitioner.chunkSize(100, 10));
		// Small ratio, whole axis
		assertEquals(50, ChunkPartitioner.chunkSize(50, 10));
		// Capped at six template sizes
		assertEquals(60, ChunkPartitioner.chunkSize(1000, 10));
		// Never below two template sizes
		assertEquals(20, ChunkPartitioner.chunkSize(60, 10));
		assertEquals(9, ChunkPartitioner.overlap(100, 10, 25));
		assertEquals(10, ChunkPartitioner.overlap(50, 10, 50));
	}

	@Test
	public void smallScanIsOneChunk() throws InterruptedException {
		List<Chunk> chunks = new ChunkPartitioner().partition(scan(40, 30), 10, 10);

		assertEquals(1, chunks.size());
		assertEquals(40, chunks.get(0).getWidth());
		assertEquals(30, chunks.get(0).getHeight());
	}

	@Test
	public void chunksCopyScanPixels() throws InterruptedException {
		NormalizedRaster scan = scan(120, 90);
		List<Chunk> chunks = new ChunkPartitioner().partition(scan, 8, 8);

		assertTrue(chunks.size() > 1);
		for (Chunk chunk : chunks) {
			InterleavedU8 pixels = chunk.getPixels();
			for (int y = 0; y < chunk.getHeight(); y += 3) {
				for (int x = 0; x < chunk.getWidth(); x += 3) {
					for (int band = 0; band < NormalizedRaster.BANDS; band++) {
						assertEquals(scan.unsafe_get(chunk.getOriginX() + x, chunk.getOriginY() + y, band), pixels.getBand(x, y, band));
					}
				}
			}
		}
	}

	@Test
	public void parallelExtractionMatchesSequential() throws InterruptedException {
		NormalizedRaster scan = scan(300, 200);
		ExecutorService executor = Executors.newFixedThreadPool(3);
		try {
			List<Chunk> sequential = new ChunkPartitioner().partition(scan, 11, 9);
			List<Chunk> parallel = new ChunkPartitioner(executor).partition(scan, 11, 9);

			assertEquals(sequential.size(), parallel.size());
			for (int i = 0; i < sequential.size(); i++) {
				assertEquals(sequential.get(i).toString(), parallel.get(i).toString());
			}
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	public void templateLargerThanScanIsRejected() {
		NormalizedRaster scan = scan(20, 20);
		ChunkPartitioner partitioner = new ChunkPartitioner();

		TemplateDimensionException e = assertThrows(TemplateDimensionException.class, () -> partitioner.partition(scan, 21, 5));
		assertEquals(21, e.getTemplateWidth());
		assertThrows(TemplateDimensionException.class, () -> partitioner.partition(scan, 5, 0));
	}

}
