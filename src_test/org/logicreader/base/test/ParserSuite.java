package org.logicreader.base.test;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({AtomFunctionArgumentsTest.class,
                     AtomsTest.class,
                     FormulaModelTest.class,
                     FunctionsTest.class,
                     InfixExpressionsTest.class,
                     InfixOperatorsTest.class,
                     ListsTest.class,
                     ListStructureTest.class,
                     PrologFactoryTest.class,
                     RuleFormatterRunnerTest.class,
                     RulesTest.class,
                     SentenceReformatterTest.class,
                     TermsTest.class})
public class ParserSuite
{

}
