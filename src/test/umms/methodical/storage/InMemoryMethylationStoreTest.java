package umms.methodical.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class InMemoryMethylationStoreTest {

	private static InMemoryMethylationStore store() {
		return new InMemoryMethylationStore.Builder(List.of("a", "b"))
				.addSite("chr1", 300, new double[] {0.3, 0.4})
				.addSite("chr1", 100, new double[] {0.1, 0.2})
				.addSite("chr2", 50, new double[] {0.5, Double.NaN})
				.addSite("chr1", 200, new double[] {0.2, 0.3})
				.build();
	}

	@Test
	void sitesAreSortedPerSequence() {
		InMemoryMethylationStore store = store();

		assertThat(store.getSiteIndex("chr1")).containsExactly(100, 200, 300);
		assertThat(store.getSiteIndex("chr2")).containsExactly(50);
		assertThat(store.getSiteIndex("chrX")).isEmpty();
		assertThat(store.getNumSites()).isEqualTo(4);
		assertThat(store.getSequenceNames()).containsExactly("chr1", "chr2");
	}

	@Test
	void rangeQueryIsInclusive() {
		SiteValueMatrix matrix = store().getSiteValues("chr1", 100, 200);

		assertThat(matrix.getPositions()).containsExactly(100, 200);
		assertThat(matrix.getSiteValues(1, new int[] {0, 1})).containsExactly(0.2, 0.3);
		assertThat(matrix.getValue(0, 1)).isEqualTo(0.2);
		assertThat(matrix.getSampleNames()).containsExactly("a", "b");
	}

	@Test
	void emptyRanges() {
		InMemoryMethylationStore store = store();

		assertThat(store.getSiteValues("chr1", 101, 199).getNumSites()).isZero();
		assertThat(store.getSiteValues("chr1", 300, 100).getNumSites()).isZero();
		assertThat(store.getSiteValues("chr9", 1, 1000).getNumSites()).isZero();
	}

	@Test
	void missingValuesArePreserved() {
		assertThat(store().getSiteValues("chr2", 50, 50).getValue(0, 1)).isNaN();
	}

	@Test
	void siteSubsetByColumn() {
		SiteValueMatrix matrix = store().getSiteValues("chr1", 1, 1000);

		assertThat(matrix.getSiteValues(2, new int[] {1})).containsExactly(0.4);
	}

	@Test
	void wrongNumberOfValuesIsRejected() {
		InMemoryMethylationStore.Builder builder = new InMemoryMethylationStore.Builder(List.of("a", "b"));

		assertThatThrownBy(() -> builder.addSite("chr1", 1, new double[] {0.1})).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void featureLookup() {
		FeatureTable table = new FeatureTable(List.of("a", "b"), Map.of("g1", new double[] {1.0, Double.NaN}));

		FeatureVector vector = table.getFeatureVector("g1");
		assertThat(vector.getValue("a")).isEqualTo(1.0);
		assertThat(vector.getValue("zzz")).isNaN();
		assertThat(table.getFeatureVector("g2")).isNull();
		assertThat(table.hasFeature("g1")).isTrue();
	}
}
