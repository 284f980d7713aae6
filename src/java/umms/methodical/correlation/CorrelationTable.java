package umms.methodical.correlation;

import java.util.Iterator;
import java.util.List;

import umms.methodical.math.CorrelationMethod;
import umms.methodical.math.PValueAdjustment;

/**
 * Result of correlating every column of table1 with every column of table2.
 * Records are grouped by table1 column, then ordered by table2 column.
 */
public final class CorrelationTable implements Iterable<CorrelationRecord> {

	private final List<CorrelationRecord> records;
	private final int numColumns1;
	private final int numColumns2;
	private final String table1Name;
	private final String table2Name;
	private final CorrelationMethod method;
	private final PValueAdjustment adjustment;

	CorrelationTable(List<CorrelationRecord> records, int numColumns1, int numColumns2, String table1Name, String table2Name,
			CorrelationMethod method, PValueAdjustment adjustment) {
		this.records = List.copyOf(records);
		this.numColumns1 = numColumns1;
		this.numColumns2 = numColumns2;
		this.table1Name = table1Name;
		this.table2Name = table2Name;
		this.method = method;
		this.adjustment = adjustment;
	}

	public List<CorrelationRecord> getRecords() {
		return records;
	}

	/**
	 * @param i column of table1
	 * @param j column of table2
	 */
	public CorrelationRecord get(int i, int j) {
		if (i < 0 || i >= numColumns1 || j < 0 || j >= numColumns2) {
			throw new IndexOutOfBoundsException("No record for columns " + i + ", " + j);
		}
		return records.get(i * numColumns2 + j);
	}

	public int size() {
		return records.size();
	}

	public int getNumColumns1() {
		return numColumns1;
	}

	public int getNumColumns2() {
		return numColumns2;
	}

	/**
	 * Header label for the table1 feature column
	 */
	public String getTable1Name() {
		return table1Name;
	}

	public String getTable2Name() {
		return table2Name;
	}

	public CorrelationMethod getMethod() {
		return method;
	}

	public PValueAdjustment getAdjustment() {
		return adjustment;
	}

	/**
	 * @return false when the adjustment method was none, in which case records carry no q-value
	 */
	public boolean hasQValues() {
		return adjustment != PValueAdjustment.NONE;
	}

	@Override
	public Iterator<CorrelationRecord> iterator() {
		return records.iterator();
	}
}
