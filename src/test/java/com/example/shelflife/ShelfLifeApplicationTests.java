package com.example.shelflife;

import com.example.shelflife.model.ShelfLifeRegressionModel;
import com.example.shelflife.repository.PredictionHistoryRepository;
import com.example.shelflife.service.ShelfLifePredictionService;
import com.example.shelflife.util.ShelfLifeRequest;
import com.example.shelflife.util.ShelfLifeResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
@ActiveProfiles("test")
class ShelfLifeApplicationTests {

  @TempDir
  static Path dataDir;

  @DynamicPropertySource
  static void historyLocation(DynamicPropertyRegistry registry) {
    registry.add("shelf-life.history.path", () -> dataDir.resolve("history.json").toString());
  }

  @Autowired
  private ShelfLifePredictionService predictionService;

  @Autowired
  private ShelfLifeRegressionModel model;

  @Autowired
  private PredictionHistoryRepository historyRepository;

  @Test
  void wiresTheEngineFromConfiguration() {
    assertThat(model.featureNames()).containsExactly("Temperature_C", "Humidity_%", "Type_Apple", "Type_Banana");
    assertThat(historyRepository.retentionLimit()).isEqualTo(5);

    ShelfLifeResult result = predictionService.predict(ShelfLifeRequest.of("Apple", 5.0, 90.0));

    assertThat(result.arrheniusPrediction()).isCloseTo(60.0, within(1e-9));
    assertThat(result.mlPrediction()).isCloseTo(40.0, within(1e-9));
    assertThat(result.hybridPrediction()).isCloseTo(0.35 * 60.0 + 0.65 * 40.0, within(1e-9));
    assertThat(historyRepository.findAll()).isNotEmpty();
  }
}
