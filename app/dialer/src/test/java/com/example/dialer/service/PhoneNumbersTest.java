package com.example.dialer.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PhoneNumbersTest {

  @Test
  void tenDigitNumberIsTreatedAsNorthAmerican() {
    assertThat(PhoneNumbers.toE164("(415) 555-0100")).contains("+14155550100");
  }

  @Test
  void existingCountryCodeIsKept() {
    assertThat(PhoneNumbers.toE164("+1 415 555 0100")).contains("+14155550100");
    assertThat(PhoneNumbers.toE164("14155550100")).contains("+14155550100");
    assertThat(PhoneNumbers.toE164("+81 3 1234 5678")).contains("+81312345678");
  }

  @Test
  void tooShortOrBlankIsRejected() {
    assertThat(PhoneNumbers.toE164("555-0100")).isEmpty();
    assertThat(PhoneNumbers.toE164(" ")).isEmpty();
    assertThat(PhoneNumbers.toE164(null)).isEmpty();
    assertThat(PhoneNumbers.toE164("1234567890123456")).isEmpty();
  }

  @Test
  void areaCodeOnlyForNorthAmericanNumbers() {
    assertThat(PhoneNumbers.areaCode("+14155550100")).contains("415");
    assertThat(PhoneNumbers.areaCode("+81312345678")).isEmpty();
  }
}
