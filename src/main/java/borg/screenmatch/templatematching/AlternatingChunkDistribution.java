package borg.screenmatch.templatematching;

import java.util.ArrayList;
import java.util.List;

/**
 * Deals chunks to the groups in turn, each group taking one chunk from the front and one from the back of
 * the list. Neighbouring chunks end up in different groups, and every group gets work from both ends of the
 * scan.
 */
public class AlternatingChunkDistribution implements ChunkDistribution {

	@Override
	public List<List<Chunk>> distribute(List<Chunk> chunks, int groups) {
		if (groups <= 0) {
			throw new IllegalArgumentException("Number of groups must be positive, got " + groups);
		}

		List<List<Chunk>> result = new ArrayList<>(groups);
		for (int i = 0; i < groups; i++) {
			result.add(new ArrayList<Chunk>(chunks.size() / groups + 2));
		}

		int front = 0;
		int back = chunks.size() - 1;
		int group = 0;
		while (front <= back) {
			List<Chunk> target = result.get(group);
			target.add(chunks.get(front++));
			if (front <= back) {
				target.add(chunks.get(back--));
			}
			group = (group + 1) % groups;
		}

		return result;
	}

	@Override
	public String toString() {
		return "alternating";
	}

}
