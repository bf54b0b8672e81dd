package com.alyaman.ledger.config;

import com.alyaman.ledger.domain.Account.AccountType;

/**
 * Accounts owned by a single student, course, teacher or employee. Each kind has its own code
 * prefix and its accounts sit under the shared account of the given purpose, coded
 * {@code <prefix>-<owner id padded to 3 digits>}.
 */
public enum OwnedAccountKind {
  STUDENT_RECEIVABLE(
      "1251", AccountPurpose.STUDENT_RECEIVABLES, AccountType.ASSET, "AR - %s", "ذمة %s"),
  COURSE_DEFERRED_REVENUE(
      "21001",
      AccountPurpose.DEFERRED_REVENUE,
      AccountType.LIABILITY,
      "Deferred Revenue - %s",
      "إيرادات مؤجلة - %s"),
  COURSE_REVENUE(
      "4101",
      AccountPurpose.COURSE_REVENUE,
      AccountType.REVENUE,
      "Course Revenue - %s",
      "إيرادات دورة - %s"),
  TEACHER_SALARY(
      "501", AccountPurpose.TEACHER_SALARIES, AccountType.EXPENSE, "Salary Expense - %s", "راتب - %s"),
  EMPLOYEE_SALARY(
      "502",
      AccountPurpose.EMPLOYEE_SALARIES,
      AccountType.EXPENSE,
      "Salary Expense - %s",
      "راتب - %s"),
  EMPLOYEE_ADVANCE(
      "1241",
      AccountPurpose.EMPLOYEE_ADVANCES,
      AccountType.ASSET,
      "Employee Advance - %s",
      "سلفة - %s"),
  TEACHER_ADVANCE(
      "1242", AccountPurpose.TEACHER_ADVANCES, AccountType.ASSET, "Teacher Advance - %s", "سلفة - %s"),
  TEACHER_DUES(
      "22", AccountPurpose.TEACHER_DUES, AccountType.LIABILITY, "Teacher Dues - %s", "مستحقات - %s");

  private final String defaultPrefix;
  private final AccountPurpose parentPurpose;
  private final AccountType type;
  private final String nameFormat;
  private final String localizedNameFormat;

  OwnedAccountKind(
      String defaultPrefix,
      AccountPurpose parentPurpose,
      AccountType type,
      String nameFormat,
      String localizedNameFormat) {
    this.defaultPrefix = defaultPrefix;
    this.parentPurpose = parentPurpose;
    this.type = type;
    this.nameFormat = nameFormat;
    this.localizedNameFormat = localizedNameFormat;
  }

  public String getDefaultPrefix() {
    return defaultPrefix;
  }

  public AccountPurpose getParentPurpose() {
    return parentPurpose;
  }

  public AccountType getType() {
    return type;
  }

  public String nameFor(String ownerName) {
    return String.format(nameFormat, ownerName);
  }

  public String localizedNameFor(String ownerName) {
    return String.format(localizedNameFormat, ownerName);
  }
}
