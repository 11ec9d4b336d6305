package borg.screenmatch.templatematching;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Plain round robin over the groups, with every second group scanning its chunks back to front.
 */
public class ReversingRoundRobinDistribution implements ChunkDistribution {

	@Override
	public List<List<Chunk>> distribute(List<Chunk> chunks, int groups) {
		if (groups <= 0) {
			throw new IllegalArgumentException("Number of groups must be positive, got " + groups);
		}

		List<List<Chunk>> result = new ArrayList<>(groups);
		for (int i = 0; i < groups; i++) {
			result.add(new ArrayList<Chunk>(chunks.size() / groups + 1));
		}
		for (int i = 0; i < chunks.size(); i++) {
			result.get(i % groups).add(chunks.get(i));
		}
		for (int i = 1; i < groups; i += 2) {
			Collections.reverse(result.get(i));
		}

		return result;
	}

	@Override
	public String toString() {
		return "reversing round robin";
	}

}
