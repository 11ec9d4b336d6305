package borg.screenmatch.templatematching;

import java.io.Serializable;

/**
 * Top-left corner of an accepted match, relative to the scan origin.
 */
public class MatchResult implements Serializable, Comparable<MatchResult> {

	private static final long serialVersionUID = 6207425716281453981L;

	private final int x;
	private final int y;
	private final double score;

	public MatchResult(int x, int y, double score) {
		this.x = x;
		this.y = y;
		this.score = score;
	}

	public int getX() {
		return x;
	}

	public int getY() {
		return y;
	}

	/**
	 * Dissimilarity which got this match accepted, 0 is a perfect match
	 */
	public double getScore() {
		return score;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		MatchResult other = (MatchResult) obj;
		if (x != other.x)
			return false;
		if (y != other.y)
			return false;
		return true;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + x;
		result = prime * result + y;
		return result;
	}

	@Override
	public String toString() {
		return this.x + "/" + this.y;
	}

	@Override
	public int compareTo(MatchResult other) {
		if (this.x < other.x) {
			return -1;
		} else if (this.x > other.x) {
			return 1;
		} else if (this.y < other.y) {
			return -1;
		} else if (this.y > other.y) {
			return 1;
		} else {
			return 0;
		}
	}

}
