package org.sedfuse.application.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.sedfuse.domain.physics.Cosmology;
import org.sedfuse.domain.sed.DataSource;
import org.sedfuse.domain.sed.Measurement;
import org.sedfuse.domain.sed.MeasurementFlag;
import org.sedfuse.domain.sed.Source;
import org.sedfuse.domain.sky.SkyPosition;

class ResultAggregatorTest {
  private final ResultAggregator aggregator =
      new ResultAggregator(OutputTemplate.compile("{num} {source} {freq:%.1e}", List.of()));

  private static Source withMeasurements(double z) {
    Source source = new Source(4, "obj", Optional.empty(), Optional.empty(), new SkyPosition(5, 5), z, Map.of());
    source.append(new Measurement.Draft(1e10, 2.0, DataSource.PRIMARY, SkyPosition.UNKNOWN, 0, 1.0,
        MeasurementFlag.SINGLE));
    source.append(new Measurement.Draft(2e15, 1e-5, DataSource.UV_SURVEY, new SkyPosition(5, 5), 0.5, 2.0,
        MeasurementFlag.AVERAGED));
    return source;
  }

  @Test
  void rendersOneLinePerMeasurementInOrder() {
    assertEquals(List.of("1 NED 1.0e+10", "2 GALEX 2.0e+15"), aggregator.render(withMeasurements(0.3)));
  }

  @Test
  void plotPlacesLuminosityInDataSourceColumn() {
    double z = 0.3;
    PlotTable table = aggregator.plot(withMeasurements(z)).orElseThrow();
    Cosmology cosmology = Cosmology.standard();

    PlotTable.Row uv = table.rows().get(1);
    assertEquals(2e15 * 1.3, uv.restFrequencyHz(), 1.0);
    assertEquals(cosmology.luminosity(z, 1e-5, 2.0), uv.luminosity(DataSource.UV_SURVEY));
    for (DataSource other : List.of(DataSource.PRIMARY, DataSource.SURVEY_A, DataSource.SURVEY_B)) {
      assertEquals(0.0, uv.luminosity(other));
    }
    assertEquals(PlotTable.header(), table.lines().get(0));
  }

  @Test
  void zeroRedshiftGivesZeroLuminosity() {
    PlotTable table = aggregator.plot(withMeasurements(0.0)).orElseThrow();
    for (PlotTable.Row row : table.rows()) {
      for (double value : row.luminosities()) {
        assertEquals(0.0, value);
      }
    }
  }

  @Test
  void unknownRedshiftOrNoMeasurementsGivesNoPlot() {
    assertTrue(aggregator.plot(withMeasurements(Double.NaN)).isEmpty());
    Source empty = new Source(1, "e", Optional.empty(), Optional.empty(), SkyPosition.UNKNOWN, 0.2, Map.of());
    assertTrue(aggregator.plot(empty).isEmpty());
  }
}
