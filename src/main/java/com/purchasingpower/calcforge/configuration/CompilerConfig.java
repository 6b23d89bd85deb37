package com.purchasingpower.calcforge.configuration;

import com.purchasingpower.calcforge.formula.FormulaEvaluator;
import com.purchasingpower.calcforge.formula.FormulaParser;
import com.purchasingpower.calcforge.formula.FormulaTokenizer;
import com.purchasingpower.calcforge.formula.RangeExpander;
import com.purchasingpower.calcforge.formula.TypeInferencer;
import com.purchasingpower.calcforge.formula.TypeScriptTranslator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the formula front end. The range cap is read once here so every
 * consumer of {@link RangeExpander} shares the same instance and the same limit.
 */
@Slf4j
@Configuration
public class CompilerConfig {

    @Bean
    public RangeExpander rangeExpander(CalcForgeProperties properties) {
        log.info("Range expansion cap: {} cells", properties.getRangeExpansionCap());
        return new RangeExpander(properties.getRangeExpansionCap());
    }

    @Bean
    public FormulaTokenizer formulaTokenizer() {
        return new FormulaTokenizer();
    }

    @Bean
    public FormulaParser formulaParser(FormulaTokenizer tokenizer, RangeExpander rangeExpander) {
        return new FormulaParser(tokenizer, rangeExpander);
    }

    @Bean
    public Clock compilerClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public FormulaEvaluator formulaEvaluator(RangeExpander rangeExpander, Clock compilerClock) {
        return new FormulaEvaluator(rangeExpander, compilerClock);
    }

    @Bean
    public TypeInferencer typeInferencer(RangeExpander rangeExpander) {
        return new TypeInferencer(rangeExpander);
    }

    @Bean
    public TypeScriptTranslator typeScriptTranslator(RangeExpander rangeExpander) {
        return new TypeScriptTranslator(rangeExpander);
    }
}
