package com.project.coin.measurement;

import com.project.coin.measurement.TestImages.MaskBuilder;
import com.project.coin.measurement.model.BinaryMask;
import com.project.coin.measurement.model.DetectedObject;
import com.project.coin.measurement.service.CandidateExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CandidateExtractorTest {
    private final CandidateExtractor extractor = new CandidateExtractor(500);

    @Test
    void extract_filledSquare_fitsCircleThroughCorners() {
        BinaryMask mask = new MaskBuilder(100, 100).fill(10, 10, 30, 30).build();

        List<DetectedObject> objects = extractor.extract(mask, null);

        assertThat(objects).hasSize(1);
        DetectedObject o = objects.get(0);
        assertThat(o.id()).isEqualTo(1);
        assertThat(o.center().x()).isCloseTo(24.5, within(1e-4));
        assertThat(o.center().y()).isCloseTo(24.5, within(1e-4));
        assertThat(o.diameterPx()).isCloseTo(29 * Math.sqrt(2), within(1e-4));
        assertThat(o.physicalDiameter()).isEmpty();
    }

    @Test
    void extract_disk_diameterMatches() {
        boolean[] px = new boolean[200 * 200];
        for (int y = 0; y < 200; y++) {
            for (int x = 0; x < 200; x++) {
                int dx = x - 100, dy = y - 90;
                px[y * 200 + x] = dx * dx + dy * dy <= 50 * 50;
            }
        }

        List<DetectedObject> objects = extractor.extract(new BinaryMask(200, 200, px), null);

        assertThat(objects).hasSize(1);
        assertThat(objects.get(0).diameterPx()).isCloseTo(100.0, within(1e-4));
        assertThat(objects.get(0).center().x()).isCloseTo(100.0, within(1e-4));
        assertThat(objects.get(0).center().y()).isCloseTo(90.0, within(1e-4));
    }

    @Test
    void extract_regionsBelowMinimumArea_areRejected() {
        // traced areas: 22*22 = 484 (rejected) and 23*23 = 529 (kept)
        BinaryMask mask = new MaskBuilder(120, 60)
                .fill(5, 5, 23, 23)
                .fill(60, 5, 24, 24)
                .fill(100, 50, 3, 3)
                .build();

        List<DetectedObject> objects = extractor.extract(mask, null);

        assertThat(objects).hasSize(1);
        assertThat(objects.get(0).id()).isEqualTo(1);
        assertThat(objects.get(0).center().x()).isCloseTo(71.5, within(1e-4));
    }

    @Test
    void extract_idsFollowDiscoveryOrder() {
        BinaryMask mask = new MaskBuilder(100, 100)
                .fill(5, 50, 40, 40)
                .fill(60, 5, 30, 30)
                .build();

        List<DetectedObject> objects = extractor.extract(mask, null);

        assertThat(objects).extracting(DetectedObject::id).containsExactly(1, 2);
        // the upper region is met first in raster order
        assertThat(objects.get(0).center().y()).isCloseTo(19.5, within(1e-4));
        assertThat(objects.get(1).center().y()).isCloseTo(69.5, within(1e-4));
    }

    @Test
    void extract_islandInsideHole_isSeparateNestedCandidate() {
        BinaryMask mask = new MaskBuilder(100, 100)
                .fill(10, 10, 60, 60)
                .clear(20, 20, 40, 40)
                .fill(28, 28, 24, 24)
                .build();

        List<DetectedObject> objects = extractor.extract(mask, null);

        assertThat(objects).hasSize(2);
        assertThat(objects.get(0).diameterPx()).isCloseTo(59 * Math.sqrt(2), within(1e-4));
        assertThat(objects.get(1).diameterPx()).isCloseTo(23 * Math.sqrt(2), within(1e-4));
        assertThat(objects.get(0).center().distanceTo(objects.get(1).center())).isCloseTo(0.0, within(1e-4));
    }

    @Test
    void extract_diagonallyTouchingSquares_formOneRegion() {
        BinaryMask mask = new MaskBuilder(100, 100)
                .fill(10, 10, 30, 30)
                .fill(40, 40, 30, 30)
                .build();

        List<DetectedObject> objects = extractor.extract(mask, null);

        assertThat(objects).hasSize(1);
        assertThat(objects.get(0).diameterPx()).isCloseTo(59 * Math.sqrt(2), within(1e-4));
    }

    @Test
    void extract_withScale_reportsPhysicalDiameter() {
        BinaryMask mask = new MaskBuilder(100, 100).fill(10, 10, 30, 30).build();

        DetectedObject o = extractor.extract(mask, 0.25).get(0);

        assertThat(o.physicalDiameter()).hasValueSatisfying(
                mm -> assertThat(mm).isCloseTo(o.diameterPx() * 0.25, within(1e-9)));
    }

    @Test
    void extract_emptyMask_noCandidates() {
        assertThat(extractor.extract(new MaskBuilder(50, 50).build(), null)).isEmpty();
    }

    @Test
    void extract_doesNotModifyMask() {
        BinaryMask mask = new MaskBuilder(100, 100).fill(10, 10, 30, 30).fill(50, 50, 30, 30).build();
        boolean[] before = mask.toArray();

        extractor.extract(mask, 1.0);

        assertThat(mask.toArray()).isEqualTo(before);
    }

    @Test
    void extract_regionTouchingImageBorder_isMeasured() {
        BinaryMask mask = new MaskBuilder(60, 60).fill(0, 0, 40, 40).build();

        List<DetectedObject> objects = extractor.extract(mask, null);

        assertThat(objects).hasSize(1);
        assertThat(objects.get(0).diameterPx()).isCloseTo(39 * Math.sqrt(2), within(1e-4));
    }

    @Test
    void extract_regionFillingBottomRightCorner_keepsFullOutline() {
        BinaryMask mask = new MaskBuilder(60, 60).fill(30, 30, 30, 30).build();

        List<DetectedObject> objects = extractor.extract(mask, null);

        assertThat(objects).hasSize(1);
        assertThat(objects.get(0).center().x()).isCloseTo(44.5, within(1e-4));
        assertThat(objects.get(0).center().y()).isCloseTo(44.5, within(1e-4));
        assertThat(objects.get(0).diameterPx()).isCloseTo(29 * Math.sqrt(2), within(1e-4));
    }

    @Test
    void extract_regionsOnSameRow_numberedLeftToRight() {
        BinaryMask mask = new MaskBuilder(120, 60)
                .fill(70, 10, 30, 30)
                .fill(10, 10, 30, 30)
                .build();

        List<DetectedObject> objects = extractor.extract(mask, null);

        assertThat(objects).extracting(DetectedObject::id).containsExactly(1, 2);
        assertThat(objects.get(0).center().x()).isCloseTo(24.5, within(1e-4));
        assertThat(objects.get(1).center().x()).isCloseTo(84.5, within(1e-4));
    }
}
