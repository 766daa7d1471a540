package com.flamingo.ai.linkextractor.api.dto.request;

import com.flamingo.ai.linkextractor.service.pipeline.PipelineOptions;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting a pipeline run. Every field is optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunRequest {

  private static final String ISO_DATE = "\\d{4}-\\d{2}-\\d{2}";

  private Boolean fetch;
  private Boolean summarize;
  private Boolean tag;

  /** Skip unchanged note files. If null, uses the configured default. */
  private Boolean skipExisting;

  @Pattern(regexp = ISO_DATE, message = "dateFrom must be formatted as YYYY-MM-DD")
  private String dateFrom;

  @Pattern(regexp = ISO_DATE, message = "dateTo must be formatted as YYYY-MM-DD")
  private String dateTo;

  public PipelineOptions toOptions() {
    return new PipelineOptions(
        !Boolean.FALSE.equals(fetch),
        !Boolean.FALSE.equals(summarize),
        !Boolean.FALSE.equals(tag),
        skipExisting,
        dateFrom,
        dateTo);
  }
}
