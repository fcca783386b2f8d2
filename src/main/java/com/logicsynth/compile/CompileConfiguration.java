package com.logicsynth.compile;

import com.logicsynth.contract.CompileOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CompileConfiguration {

    /**
     * Sections an untrusted caller may submit. Package and Use headers are off by default:
     * synthesized logic joins the session's own package.
     */
    @Bean
    public CompileOptions compileOptions(
            @Value("${logicsynth.compile.allow-package:false}") boolean allowPackage,
            @Value("${logicsynth.compile.allow-use:false}") boolean allowUse,
            @Value("${logicsynth.compile.allow-decls:true}") boolean allowDecls,
            @Value("${logicsynth.compile.require-single-clause:false}") boolean requireSingleClause,
            @Value("${logicsynth.compile.strict-schema:false}") boolean strictSchema) {
        return new CompileOptions(allowPackage, allowUse, allowDecls, requireSingleClause, strictSchema);
    }
}
