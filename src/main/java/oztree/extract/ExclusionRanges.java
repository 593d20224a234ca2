package oztree.extract;

import gnu.trove.list.array.TIntArrayList;

/**
 * Sorted list of disjoint [start, end) text ranges to leave out of extracted subtrees.
 *	Adding a range that overlaps existing ones replaces them with their union.
 */
public class ExclusionRanges {

	// parallel lists, sorted by start; since ranges never overlap the ends are sorted too
	private final TIntArrayList starts = new TIntArrayList();
	private final TIntArrayList ends = new TIntArrayList();

	public void add(int start, int end) {
		int i = 0;
		while (i < this.starts.size() && this.ends.get(i) <= start) {
			i++;
		}
		int newStart = start;
		int newEnd = end;
		while (i < this.starts.size() && this.starts.get(i) < end) {
			newStart = Math.min(newStart, this.starts.get(i));
			newEnd = Math.max(newEnd, this.ends.get(i));
			this.starts.removeAt(i);
			this.ends.removeAt(i);
		}
		this.starts.insert(i, newStart);
		this.ends.insert(i, newEnd);
	}

	public int size() {
		return this.starts.size();
	}

	public int getStart(int i) {
		return this.starts.get(i);
	}

	public int getEnd(int i) {
		return this.ends.get(i);
	}

	/**
	 * Copies text[nodeStart, nodeEnd) into `sb`, leaving out the ranges that start strictly
	 *	inside the node. A range running past nodeEnd is clipped to it.
	 */
	public void appendWithout(CharSequence text, int nodeStart, int nodeEnd, StringBuilder sb) {
		int prevEnd = nodeStart;
		for (int i = 0; i < this.starts.size(); i++) {
			int rs = this.starts.get(i);
			if (rs >= nodeEnd) {
				break;
			}
			if (rs > nodeStart && this.ends.get(i) > prevEnd) {
				appendChunk(text, Math.max(prevEnd, nodeStart), rs, sb);
				prevEnd = Math.min(this.ends.get(i), nodeEnd);
			}
		}
		appendChunk(text, prevEnd, nodeEnd, sb);
	}

	/**
	 * Appends text[start, end), dropping a leading comma right after an open parenthesis, since
	 *	removing the first child(ren) of a node would otherwise leave "(,".
	 */
	static void appendChunk(CharSequence text, int start, int end, StringBuilder sb) {
		if (start >= end) {
			return;
		}
		if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '(' && text.charAt(start) == ',') {
			start++;
		}
		sb.append(text, start, end);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		for (int i = 0; i < this.starts.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append('[').append(this.starts.get(i)).append(',').append(this.ends.get(i)).append(')');
		}
		return sb.append(']').toString();
	}
}
