package com.flamingo.ai.hybridrag.service.ingestion;

import com.flamingo.ai.hybridrag.exception.DocumentNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads a document as UTF-8 text. References with a {@code classpath:} or {@code file:} prefix are
 * resolved by Spring's {@link ResourceLoader}; anything else is treated as a file system path.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentLoader {

  private final ResourceLoader resourceLoader;

  /**
   * Loads the referenced document.
   *
   * @param documentRef file path or resource URL
   * @return full document text
   * @throws DocumentNotFoundException if the reference is not a usable location, or the document
   *     does not exist or cannot be read
   */
  public String load(String documentRef) {
    Resource resource;
    try {
      resource = resolve(documentRef);
    } catch (IllegalArgumentException e) {
      // InvalidPathException for file system paths, malformed URLs for prefixed references
      throw new DocumentNotFoundException(documentRef, e);
    }
    if (!resource.exists() || !resource.isReadable()) {
      throw new DocumentNotFoundException(documentRef);
    }
    try {
      String text = resource.getContentAsString(StandardCharsets.UTF_8);
      log.debug("Loaded {} ({} chars)", documentRef, text.length());
      return text;
    } catch (IOException e) {
      throw new DocumentNotFoundException(documentRef, e);
    }
  }

  private Resource resolve(String documentRef) {
    if (documentRef.startsWith(ResourceLoader.CLASSPATH_URL_PREFIX)
        || documentRef.startsWith("file:")) {
      return resourceLoader.getResource(documentRef);
    }
    return new FileSystemResource(documentRef);
  }
}
