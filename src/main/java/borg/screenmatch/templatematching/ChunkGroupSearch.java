package borg.screenmatch.templatematching;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Body of one pool task: scans a group of chunks until a match is accepted here or elsewhere, or the search
 * is cancelled. The flag and the token are checked between chunks, rows and columns.
 */
public class ChunkGroupSearch implements Callable<MatchResult> {

	private final List<Chunk> chunks;
	private final SimilarityScorer scorer;
	private final AtomicBoolean matchFound;
	private final BlockingQueue<MatchResult> resultSlot;
	private final SearchCancellation cancellation;

	public ChunkGroupSearch(List<Chunk> chunks, SimilarityScorer scorer, AtomicBoolean matchFound, BlockingQueue<MatchResult> resultSlot, SearchCancellation cancellation) {
		this.chunks = chunks;
		this.scorer = scorer;
		this.matchFound = matchFound;
		this.resultSlot = resultSlot;
		this.cancellation = cancellation;
	}

	/**
	 * @return The match this task won, or <code>null</code>
	 */
	@Override
	public MatchResult call() {
		final int templateWidth = this.scorer.getTemplate().getWidth();
		final int templateHeight = this.scorer.getTemplate().getHeight();

		for (Chunk chunk : this.chunks) {
			if (this.isDone()) {
				return null;
			}
			final int maxY = chunk.getHeight() - templateHeight;
			final int maxX = chunk.getWidth() - templateWidth;
			for (int y = 0; y <= maxY; y++) {
				if (this.isDone()) {
					return null;
				}
				for (int x = 0; x <= maxX; x++) {
					if (this.isDone()) {
						return null;
					}
					final double score = this.scorer.score(chunk, x, y);
					final int scanX = chunk.getOriginX() + x;
					final int scanY = chunk.getOriginY() + y;
					if (this.scorer.accepts(score, scanX, scanY)) {
						if (this.matchFound.compareAndSet(false, true)) {
							MatchResult result = new MatchResult(scanX, scanY, score);
							this.resultSlot.offer(result);
							return result;
						}
						return null;
					}
				}
			}
		}
		return null;
	}

	private boolean isDone() {
		return this.matchFound.get() || this.cancellation.isCancelled();
	}

}
