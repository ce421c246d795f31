package com.example.shelflife.config;

import com.example.shelflife.domain.KineticProfileTable;
import com.example.shelflife.model.RegressionModelLoader;
import com.example.shelflife.model.ShelfLifeRegressionModel;
import com.example.shelflife.repository.JsonFilePredictionHistoryRepository;
import com.example.shelflife.repository.PredictionHistoryRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;

@Slf4j
@Configuration
public class ShelfLifeConfig {
  @Bean
  public KineticProfileTable kineticProfileTable() {
    KineticProfileTable table = KineticProfileTable.defaults();
    log.info("Kinetic profiles loaded for products {}", table.products());
    return table;
  }

  @Bean
  public RegressionModelLoader regressionModelLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
    return new RegressionModelLoader(objectMapper, resourceLoader);
  }

  @Bean
  public ShelfLifeRegressionModel shelfLifeRegressionModel(
      RegressionModelLoader loader,
      @Value("${shelf-life.model.location:classpath:models/shelf-life-model.json}") String location
  ) {
    return loader.load(location);
  }

  @Bean
  public PredictionHistoryRepository predictionHistoryRepository(
      ObjectMapper objectMapper,
      @Value("${shelf-life.history.path:./data/prediction_history.json}") String path,
      @Value("${shelf-life.history.limit:120}") int limit
  ) {
    return new JsonFilePredictionHistoryRepository(Path.of(path), Math.max(1, limit), objectMapper);
  }
}
