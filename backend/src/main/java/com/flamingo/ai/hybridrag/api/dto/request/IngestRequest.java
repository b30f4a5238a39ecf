package com.flamingo.ai.hybridrag.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a document. Omitting the path ingests the default document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

  private String path;
}
