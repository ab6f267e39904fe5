package com.eainde.nlg.template;

import com.eainde.nlg.exception.TemplateReadingException;
import com.eainde.nlg.model.LhsExpr;
import com.eainde.nlg.model.Literal;
import com.eainde.nlg.model.Matcher;
import com.eainde.nlg.model.Rule;
import com.eainde.nlg.model.Slot;
import com.eainde.nlg.model.SlotSource;
import com.eainde.nlg.model.Template;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateReaderTest {

    private final TemplateReader reader = new TemplateReader();

    // =========================================================================
    //  Blocks and languages
    // =========================================================================

    @Nested
    @DisplayName("Blocks and languages")
    class Blocks {

        @Test
        @DisplayName("should group templates by their language prefix")
        void languagePrefixes() {
            Map<String, List<Template>> templates = reader.read("""
                    en: the {value_type} was {value}
                    fi: {value_type} oli {value}
                    | value_type = cphi:.*
                    """);

            assertThat(templates).containsOnlyKeys("en", "fi");
            assertThat(templates.get("en")).hasSize(1);
            assertThat(templates.get("fi")).hasSize(1);
        }

        @Test
        @DisplayName("should carry the language of the previous line to unprefixed lines")
        void languageCarriesOver() {
            Map<String, List<Template>> templates = reader.read("""
                    en: the {value_type} was {value}
                    it was {value}
                    | value_type = cphi:.*
                    """);

            assertThat(templates.get("en")).hasSize(2);
        }

        @Test
        @DisplayName("should switch the default language with a block holding only '<lang>:'")
        void languageSwitchBlock() {
            Map<String, List<Template>> templates = reader.read("""
                    fi:

                    {value_type} oli {value}
                    | value_type = cphi:.*
                    """);

            assertThat(templates).containsOnlyKeys("fi");
        }

        @Test
        @DisplayName("should ignore comments, value groups and blocks without rules")
        void ignoresNonTemplates() {
            Map<String, List<Template>> templates = reader.read("""
                    # a comment
                    $ {big}: a, b

                    en: no rules here

                    en: the {value_type} was {value}
                    | value_type = cphi:.*
                    """);

            assertThat(templates.get("en")).hasSize(1);
        }

        @Test
        @DisplayName("should join indented lines onto the previous line")
        void indentedContinuation() {
            Map<String, List<Template>> templates = reader.read("""
                    en: the {value_type}
                      was {value}
                    | value_type = cphi:.*
                    """);

            assertThat(templates.get("en").get(0).display()).isEqualTo("the Slot(fact.value_type) was Slot(fact.value)");
        }

        @Test
        @DisplayName("should fail when no language was ever given")
        void noLanguage() {
            assertThatThrownBy(() -> reader.read("""
                    the {value_type} was {value}
                    | value_type = cphi:.*
                    """))
                    .isInstanceOf(TemplateReadingException.class)
                    .hasMessageContaining("No language given");
        }

        @Test
        @DisplayName("should use the initial language for unprefixed templates")
        void initialLanguage() {
            Map<String, List<Template>> templates = reader.read("""
                    the {value_type} was {value}
                    | value_type = cphi:.*
                    """, "en");

            assertThat(templates).containsOnlyKeys("en");
        }
    }

    // =========================================================================
    //  Components
    // =========================================================================

    @Nested
    @DisplayName("Template components")
    class Components {

        @Test
        @DisplayName("should split literal text into words and punctuation after slots")
        void literalsAndSlots() {
            Template template = reader.read("""
                    en: in {time}, the {value_type} was {value}
                    | value_type = cphi:.*
                    """).get("en").get(0);

            assertThat(template.getComponents()).hasSize(7);
            assertThat(template.getComponents().get(0)).isEqualTo(new Literal("in"));
            assertThat(template.getComponents().get(1)).isInstanceOf(Slot.class);
            assertThat(((Slot) template.getComponents().get(1)).getSource()).isInstanceOf(SlotSource.TimeSource.class);
            assertThat(template.getComponents().get(2)).isEqualTo(new Literal(","));
            assertThat(template.slots()).extracting(Slot::slotType).containsExactly("time", "value_type", "value");
        }

        @Test
        @DisplayName("should bind slots to the first rule unless a rule number is given")
        void ruleReferences() {
            Template template = reader.read("""
                    en: {value} against {2.value}
                    | value_type = cphi:.*:rt12
                    | value_type = cphi:.*:rt1
                    """).get("en").get(0);

            assertThat(template.getRules()).hasSize(2);
            assertThat(template.getRules().get(0).slotIndices()).containsExactly(0);
            assertThat(template.getRules().get(1).slotIndices()).containsExactly(2);
        }

        @Test
        @DisplayName("should read attributes, flags and canonical case names")
        void attributes() {
            Template template = reader.read("""
                    fi: {location, case=ssa} {value, abs}
                    | value_type = cphi:.*
                    """).get("fi").get(0);

            Slot location = template.slots().get(0);
            Slot value = template.slots().get(1);
            assertThat(location.attribute(Slot.CASE)).isEqualTo("inessive");
            assertThat(value.hasFlag("abs")).isTrue();
        }

        @Test
        @DisplayName("should read quoted literal slots")
        void literalSlot() {
            Template template = reader.read("""
                    hr: u {"EU", case=loc}
                    | value_type = cphi:.*
                    """).get("hr").get(0);

            Slot literal = template.slots().get(0);
            assertThat(literal.slotType()).isEqualTo(SlotSource.LiteralSource.FIELD_NAME);
            assertThat(literal.value()).isEqualTo("EU");
            assertThat(literal.attribute(Slot.CASE)).isEqualTo("locative");
        }

        @Test
        @DisplayName("should reject rule reference 0")
        void zeroReference() {
            assertThatThrownBy(() -> reader.read("""
                    en: {0.value}
                    | value_type = cphi:.*
                    """))
                    .isInstanceOf(TemplateReadingException.class)
                    .hasMessageContaining("did you mean 1?");
        }

        @Test
        @DisplayName("should reject references past the last rule")
        void referencePastRules() {
            assertThatThrownBy(() -> reader.read("""
                    en: {2.value}
                    | value_type = cphi:.*
                    """))
                    .isInstanceOf(TemplateReadingException.class)
                    .hasMessageContaining("only has 1 rules");
        }

        @Test
        @DisplayName("should reject unknown fact fields")
        void unknownField() {
            assertThatThrownBy(() -> reader.read("""
                    en: {colour}
                    | value_type = cphi:.*
                    """))
                    .isInstanceOf(TemplateReadingException.class)
                    .hasMessageContaining("Unknown fact field 'colour'");
        }

        @Test
        @DisplayName("should reject a missing closing brace")
        void missingBrace() {
            assertThatThrownBy(() -> reader.read("""
                    en: the {value was high
                    | value_type = cphi:.*
                    """))
                    .isInstanceOf(TemplateReadingException.class)
                    .hasMessageContaining("Closing brace missing");
        }
    }

    // =========================================================================
    //  Optional parts
    // =========================================================================

    @Nested
    @DisplayName("Optional parts")
    class Alternatives {

        @Test
        @DisplayName("should expand every bracketed part into with and without")
        void expands() {
            assertThat(TemplateReader.expandAlternatives("a [b] c")).containsExactly("a b c", "a c");
            assertThat(TemplateReader.expandAlternatives("[a] [b]")).containsExactly("a b", "a", "b", "");
        }

        @Test
        @DisplayName("should produce one template per combination")
        void templatePerCombination() {
            List<Template> templates = reader.read("""
                    en: [in {time},] [in {location},] it was {value}
                    | value_type = cphi:.*
                    """).get("en");

            assertThat(templates).hasSize(4);
        }

        @Test
        @DisplayName("should reject an unmatched bracket")
        void unmatched() {
            assertThatThrownBy(() -> TemplateReader.expandAlternatives("a [b c"))
                    .isInstanceOf(TemplateReadingException.class)
                    .hasMessageContaining("Unmatched square bracket");
        }
    }

    // =========================================================================
    //  Rules
    // =========================================================================

    @Nested
    @DisplayName("Rule lines")
    class Rules {

        @Test
        @DisplayName("should mark '|*' rules as allowed to reuse bound facts")
        void reuseRule() {
            Template template = reader.read("""
                    en: {value} and {2.value}
                    | value_type = cphi:.*
                    |* location = 1.location
                    """).get("en").get(0);

            assertThat(template.getRules()).extracting(Rule::reuseAllowed).containsExactly(false, true);
        }

        @Test
        @DisplayName("should expand the shorthand '<value_type> <op> <value>'")
        void shorthand() {
            List<Matcher> matchers = reader.parseMatchers("cphi:hicp2015 > 100");

            assertThat(matchers).hasSize(2);
            assertThat(matchers.get(0).getOperator()).isEqualTo(Matcher.Operator.EQ);
            assertThat(matchers.get(0).getValue()).isEqualTo("cphi:hicp2015");
            assertThat(matchers.get(1).getOperator()).isEqualTo(Matcher.Operator.GT);
            assertThat(matchers.get(1).getValue()).isEqualTo(100);
        }

        @Test
        @DisplayName("should prefer two-character operators")
        void longestOperator() {
            List<Matcher> matchers = reader.parseMatchers("value >= 1.5, value != 0");

            assertThat(matchers).extracting(Matcher::getOperator)
                    .containsExactly(Matcher.Operator.GE, Matcher.Operator.NE);
            assertThat(matchers.get(0).getValue()).isEqualTo(1.5);
        }

        @Test
        @DisplayName("should substitute value groups")
        void valueGroups() {
            Template template = reader.read("""
                    $ {big}: cphi:hicp2015, cphi:rt12

                    en: {value}
                    | value_type in {big}
                    """).get("en").get(0);

            Matcher matcher = template.getRules().get(0).matchers().get(0);
            assertThat(matcher.getValue()).isEqualTo(Set.of("cphi:hicp2015", "cphi:rt12"));
        }

        @Test
        @DisplayName("should parse references, booleans, numbers and quoted strings")
        void values() {
            assertThat(TemplateReader.parseValue("2.location")).isInstanceOf(LhsExpr.ReferentialExpr.class);
            assertThat(TemplateReader.parseValue("True")).isEqualTo(Boolean.TRUE);
            assertThat(TemplateReader.parseValue("3")).isEqualTo(3);
            assertThat(TemplateReader.parseValue("0.5")).isEqualTo(0.5);
            assertThat(TemplateReader.parseValue("'FI'")).isEqualTo("FI");
        }

        @Test
        @DisplayName("should reject an unknown operator")
        void unknownOperator() {
            assertThatThrownBy(() -> reader.parseMatchers("value ~ 3"))
                    .isInstanceOf(TemplateReadingException.class)
                    .hasMessageContaining("Unrecognised operator");
        }
    }
}
