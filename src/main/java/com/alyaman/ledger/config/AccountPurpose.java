package com.alyaman.ledger.config;

import com.alyaman.ledger.domain.Account.AccountType;

/**
 * Shared accounts the ledger posts to by purpose rather than by literal code. The defaults here
 * can be overridden under {@code ledger.accounts.<purpose>}.
 */
public enum AccountPurpose {
  CASH("121", "Cash", "النقدية", AccountType.ASSET),
  BANK("1120", "Bank Account", "حساب البنك", AccountType.ASSET),
  STUDENT_RECEIVABLES(
      "1251", "Accounts Receivable - Students", "ذمم الطلاب المدينة", AccountType.ASSET),
  DEFERRED_REVENUE(
      "21", "Deferred Revenue - Courses", "إيرادات مؤجلة - الدورات", AccountType.LIABILITY),
  COURSE_REVENUE("4101", "Course Revenue", "إيرادات الدورات", AccountType.REVENUE),
  TEACHER_SALARIES("501", "Teacher Salaries", "رواتب المدرسين", AccountType.EXPENSE),
  EMPLOYEE_SALARIES("502", "Employee Salaries", "رواتب الموظفين", AccountType.EXPENSE),
  EMPLOYEE_ADVANCES("1241", "Employee Advances", "سلف الموظفين", AccountType.ASSET),
  TEACHER_ADVANCES("1242", "Teacher Advances", "سلف المدرسين", AccountType.ASSET),
  TEACHER_DUES("22", "Teacher Dues", "مستحقات المدرسين", AccountType.LIABILITY);

  private final String defaultCode;
  private final String defaultName;
  private final String defaultLocalizedName;
  private final AccountType defaultType;

  AccountPurpose(
      String defaultCode, String defaultName, String defaultLocalizedName, AccountType defaultType) {
    this.defaultCode = defaultCode;
    this.defaultName = defaultName;
    this.defaultLocalizedName = defaultLocalizedName;
    this.defaultType = defaultType;
  }

  public LedgerProperties.AccountDefinition defaultDefinition() {
    return new LedgerProperties.AccountDefinition(
        defaultCode, defaultName, defaultLocalizedName, defaultType);
  }
}
