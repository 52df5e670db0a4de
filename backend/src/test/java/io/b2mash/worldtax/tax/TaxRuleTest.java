package io.b2mash.worldtax.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class TaxRuleTest {

  @ParameterizedTest
  @EnumSource(
      value = RuleType.class,
      names = {"THRESHOLD_BASED"},
      mode = EnumSource.Mode.EXCLUDE)
  void simple_reportsItsOwnType(RuleType type) {
    assertThat(TaxRule.simple(type).type()).isEqualTo(type);
  }

  @Test
  void simple_thresholdBased_isRejected() {
    assertThatThrownBy(() -> TaxRule.simple(RuleType.THRESHOLD_BASED))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void thresholdBased_nestedThreshold_isRejected() {
    var inner =
        new TaxRule.ThresholdBased(BigDecimal.ONE, new TaxRule.Origin(), new TaxRule.Destination());

    assertThatThrownBy(
            () -> new TaxRule.ThresholdBased(BigDecimal.TEN, inner, new TaxRule.Destination()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void thresholdBased_partialDigitalTriple_isRejected() {
    assertThatThrownBy(
            () ->
                new TaxRule.ThresholdBased(
                    BigDecimal.TEN,
                    new TaxRule.Origin(),
                    new TaxRule.Destination(),
                    BigDecimal.ZERO,
                    null,
                    new TaxRule.Destination()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void ruleType_fromKey_matchesDocumentKeys() {
    assertThat(RuleType.fromKey("reverse_charge")).contains(RuleType.REVERSE_CHARGE);
    assertThat(RuleType.fromKey("none")).contains(RuleType.NONE);
    assertThat(RuleType.fromKey("REVERSE_CHARGE")).isEmpty();
  }
}
