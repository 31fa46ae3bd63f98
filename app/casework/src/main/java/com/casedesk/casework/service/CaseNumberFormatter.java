package com.casedesk.casework.service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/** CASE-YYYYMMDD-NNNNN 形式。5 桁を超えた番号は桁を増やしてそのまま出す。 */
@Component
public class CaseNumberFormatter {

  static final String SEQUENCE_DOMAIN = "case";
  private static final String PREFIX = "CASE";

  public String format(LocalDate date, long sequence) {
    if (sequence <= 0) {
      throw new IllegalArgumentException("sequence must be positive");
    }
    return String.format(
        "%s-%s-%05d", PREFIX, date.format(DateTimeFormatter.BASIC_ISO_DATE), sequence);
  }
}
