package com.flamingo.ai.specchunker;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specchunker.cli.IngestCommandRunner;
import com.flamingo.ai.specchunker.ingestion.pipeline.IngestionPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class SpecChunkerApplicationTests {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoads() {
    assertThat(context.getBean(IngestionPipeline.class)).isNotNull();
    assertThat(context.getBean(IngestCommandRunner.class).getExitCode()).isZero();
  }
}
