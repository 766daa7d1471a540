package com.flamingo.ai.linkextractor.domain.converter;

import com.flamingo.ai.linkextractor.domain.enums.FetchStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** JPA converter storing {@link FetchStatus} as its lower-case value ({@code not_fetched}, ...). */
@Converter
public class FetchStatusConverter implements AttributeConverter<FetchStatus, String> {

  @Override
  public String convertToDatabaseColumn(FetchStatus attribute) {
    return attribute == null ? null : attribute.getValue();
  }

  @Override
  public FetchStatus convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return FetchStatus.NOT_FETCHED;
    }
    return FetchStatus.fromValue(dbData);
  }
}
