package com.ciro.livepatch.standalone;

import com.tngtech.archunit.core.domain.JavaClass;
import com.tngtech.archunit.core.domain.JavaModifier;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchCondition;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.lang.ConditionEvents;
import com.tngtech.archunit.lang.SimpleConditionEvent;
import io.undertow.server.HttpHandler;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_USE_JAVA_UTIL_LOGGING;

@AnalyzeClasses(packages = "com.ciro.livepatch", importOptions = ImportOption.DoNotIncludeTests.class)
public class LivePatchRulesTest {

    // los handlers se comparten entre todos los requests: nada de estado mutable propio
    static final ArchCondition<JavaClass> HAVE_ONLY_FINAL_FIELDS =
            new ArchCondition<JavaClass>("tener sólo campos final") {
                @Override
                public void check(JavaClass item, ConditionEvents events) {
                    item.getFields().stream()
                            .filter(f -> !f.getModifiers().contains(JavaModifier.FINAL))
                            .forEach(f -> events.add(SimpleConditionEvent.violated(item,
                                    item.getSimpleName() + "." + f.getName() + " no es final")));
                }
            };

    @ArchTest
    static final ArchRule undertow_stays_in_standalone = noClasses()
            .that().resideOutsideOfPackage("..standalone..")
            .should().dependOnClassesThat().resideInAnyPackage("io.undertow..", "org.xnio..", "com.github.benmanes.caffeine..")
            .because("Core y cliente no dependen del servidor.");

    @ArchTest
    static final ArchRule handlers_are_stateless = classes()
            .that().implement(HttpHandler.class)
            .should(HAVE_ONLY_FINAL_FIELDS)
            .because("Undertow llama al mismo handler desde varios hilos.");

    @ArchTest
    static final ArchRule client_does_not_see_the_server = noClasses()
            .that().resideInAPackage("..client..")
            .should().dependOnClassesThat().resideInAPackage("..standalone..");

    @ArchTest
    static final ArchRule no_jul = NO_CLASSES_SHOULD_USE_JAVA_UTIL_LOGGING;

    @ArchTest
    static final ArchRule no_std_streams = NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;
}
