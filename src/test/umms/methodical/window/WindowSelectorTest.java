package umms.methodical.window;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import umms.methodical.annotation.Anchor;
import umms.methodical.annotation.GenomicPosition;
import umms.methodical.annotation.SingleInterval;
import umms.methodical.annotation.Strand;

class WindowSelectorTest {

	private static final int[] SITES = {400, 500, 900, 1000, 1300, 1600};

	private static Anchor anchor(Strand strand) {
		return new Anchor("tx1", new GenomicPosition("chr1", 1000, strand));
	}

	@Test
	void plusStrandUpstreamIsLeft() {
		SiteWindow window = WindowSelector.select(SITES, anchor(Strand.POSITIVE), 500, 300);

		assertThat(window.getBounds()).isEqualTo(new SingleInterval(500, 1300));
		assertThat(window.getSites()).extracting(WindowedSite::getPosition).containsExactly(500, 900, 1000, 1300);
		assertThat(window.getSites()).extracting(WindowedSite::getDistance).containsExactly(-500, -100, 0, 300);
		assertThat(window.getSites()).extracting(WindowedSite::getIndex).containsExactly(1, 2, 3, 4);
	}

	@Test
	void minusStrandUpstreamIsRight() {
		SiteWindow window = WindowSelector.select(SITES, anchor(Strand.NEGATIVE), 500, 300);

		assertThat(window.getBounds()).isEqualTo(new SingleInterval(700, 1500));
		assertThat(window.getSites()).extracting(WindowedSite::getPosition).containsExactly(900, 1000, 1300);
		assertThat(window.getSites()).extracting(WindowedSite::getDistance).containsExactly(100, 0, -300);
	}

	@Test
	void windowWithoutSitesIsEmpty() {
		SiteWindow window = WindowSelector.select(SITES, anchor(Strand.POSITIVE), 50, 50);

		assertThat(window.getSites()).extracting(WindowedSite::getPosition).containsExactly(1000);

		Anchor far = new Anchor("tx2", new GenomicPosition("chr1", 10000, Strand.POSITIVE));
		SiteWindow empty = WindowSelector.select(SITES, far, 100, 100);
		assertThat(empty.isEmpty()).isTrue();
		assertThat(empty.getSiteSpan()).isNull();
		assertThat(empty.toUCSC()).isEqualTo("chr1:9900-10100");
	}

	@Test
	void windowIsClippedAtSequenceStart() {
		SiteWindow window = WindowSelector.select(SITES, anchor(Strand.POSITIVE), 5000, 0);

		assertThat(window.getBounds().getStart()).isEqualTo(1);
		assertThat(window.getSiteSpan()).isEqualTo(new SingleInterval(400, 1000));
	}

	@Test
	void negativeExtentsAreRejected() {
		assertThatThrownBy(() -> WindowSelector.select(SITES, anchor(Strand.POSITIVE), -1, 10))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
