package borg.screenmatch.templatematching;

import java.util.List;

/**
 * Assigns chunks to worker groups. Only affects load spreading, never the result of a search.
 */
public interface ChunkDistribution {

	/**
	 * @return Exactly <code>groups</code> lists. Every chunk is contained in exactly one of them. Lists may
	 *         be empty if there are fewer chunks than groups.
	 */
	List<List<Chunk>> distribute(List<Chunk> chunks, int groups);

}
