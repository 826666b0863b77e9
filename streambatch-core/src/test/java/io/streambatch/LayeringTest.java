package io.streambatch;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Package boundaries of the library. */
@AnalyzeClasses(packages = "io.streambatch", importOptions = ImportOption.DoNotIncludeTests.class)
public class LayeringTest {

  /** Sources produce batches and know nothing about the operators that consume them. */
  @ArchTest
  static final ArchRule sourcesDoNotDependOnOperators =
      noClasses()
          .that()
          .resideInAnyPackage("io.streambatch.source..", "io.streambatch.spill..")
          .should()
          .dependOnClassesThat()
          .haveSimpleNameStartingWith("Streaming")
          .because("sources and spill storage sit below the streaming operators");

  /** Arrow IPC files are read and written only by sources and spill storage. */
  @ArchTest
  static final ArchRule ipcConfinedToSourcesAndSpills =
      noClasses()
          .that()
          .resideOutsideOfPackages("io.streambatch.source..", "io.streambatch.spill..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.apache.arrow.vector.ipc..")
          .because("operators work on batches, never on files");

  /** Parquet and CSV parsing stay inside the source readers. */
  @ArchTest
  static final ArchRule fileFormatLibrariesConfinedToSources =
      noClasses()
          .that()
          .resideOutsideOfPackage("io.streambatch.source..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "org.apache.parquet..", "org.apache.hadoop..", "com.fasterxml.jackson.dataformat..");

  /** Format readers are reached through BatchSource only. */
  @ArchTest
  static final ArchRule readersArePackagePrivate =
      classes()
          .that()
          .resideInAnyPackage("io.streambatch.source..", "io.streambatch.spill..")
          .and()
          .haveSimpleNameEndingWith("BatchReader")
          .or()
          .haveSimpleNameEndingWith("FileReader")
          .or()
          .haveSimpleName("ReaderFactory")
          .should()
          .notBePublic();

  /** Callers catch one exception family. */
  @ArchTest
  static final ArchRule exceptionsExtendStreamBatchException =
      classes()
          .that()
          .areAssignableTo(RuntimeException.class)
          .and()
          .doNotHaveFullyQualifiedName(StreamBatchException.class.getName())
          .should()
          .beAssignableTo(StreamBatchException.class);
}
