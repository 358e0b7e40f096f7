package stationqc.qc.statistics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AutocorrelationTest {

    @Test
    @DisplayName("Estimador sesgado: cada autocovarianza se divide por n")
    void acf_biasedEstimator() {
        double[] acf = Autocorrelation.acf(new double[]{1, 2, 3, 4, 5}, 2);

        assertThat(acf).hasSize(3);
        assertThat(acf[0]).isEqualTo(1.0);
        assertThat(acf[1]).isCloseTo(0.4, within(1e-12));
        assertThat(acf[2]).isCloseTo(-0.1, within(1e-12));
    }

    @Test
    @DisplayName("Se trunca a los retardos disponibles")
    void acf_shouldTruncateToSeriesLength() {
        assertThat(Autocorrelation.acf(new double[]{1, 2, 3, 4, 5}, 10)).hasSize(5);
        assertThat(Autocorrelation.acf(new double[0], 3)).isEmpty();
    }

    @Test
    @DisplayName("Una serie periódica tiene su máximo en el periodo")
    void acf_periodicSeriesPeaksAtPeriod() {
        double[] series = new double[96];
        for (int t = 0; t < series.length; t++) {
            series[t] = t % 8 == 3 ? 5.0 : 0.0;
        }

        double[] acf = Autocorrelation.acf(series, 12);

        int best = 1;
        for (int lag = 2; lag < acf.length; lag++) {
            if (acf[lag] > acf[best]) {
                best = lag;
            }
        }
        assertThat(best).isEqualTo(8);
    }

    @Test
    @DisplayName("Una serie constante no tiene autocorrelación definida")
    void acf_constantSeriesIsNaN() {
        double[] acf = Autocorrelation.acf(new double[]{2, 2, 2, 2}, 2);

        assertThat(acf[1]).isNaN();
    }
}
