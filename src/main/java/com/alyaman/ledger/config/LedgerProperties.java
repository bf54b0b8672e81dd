package com.alyaman.ledger.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.alyaman.ledger.domain.Account.AccountType;

/**
 * Ledger settings bound from {@code ledger.*}. Anything not set falls back to the defaults held by
 * {@link AccountPurpose} and {@link OwnedAccountKind}.
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

  private Map<AccountPurpose, AccountDefinition> accounts = new EnumMap<>(AccountPurpose.class);

  private Map<OwnedAccountKind, String> ownedPrefixes = new EnumMap<>(OwnedAccountKind.class);

  // Accounts counted as cash when building cost center cash flow
  private List<String> cashAccountCodes = new ArrayList<>(List.of("121", "1120"));

  private BigDecimal balanceTolerance = new BigDecimal("0.01");

  /** Returns the definition for a purpose, filling unset fields from the defaults. */
  public AccountDefinition account(AccountPurpose purpose) {
    AccountDefinition defaults = purpose.defaultDefinition();
    AccountDefinition override = accounts.get(purpose);
    if (override == null) {
      return defaults;
    }
    return new AccountDefinition(
        override.getCode() != null ? override.getCode() : defaults.getCode(),
        override.getName() != null ? override.getName() : defaults.getName(),
        override.getLocalizedName() != null
            ? override.getLocalizedName()
            : defaults.getLocalizedName(),
        override.getType() != null ? override.getType() : defaults.getType());
  }

  public String prefix(OwnedAccountKind kind) {
    String configured = ownedPrefixes.get(kind);
    return configured != null && !configured.isBlank() ? configured : kind.getDefaultPrefix();
  }

  public Map<AccountPurpose, AccountDefinition> getAccounts() {
    return accounts;
  }

  public void setAccounts(Map<AccountPurpose, AccountDefinition> accounts) {
    this.accounts = accounts;
  }

  public Map<OwnedAccountKind, String> getOwnedPrefixes() {
    return ownedPrefixes;
  }

  public void setOwnedPrefixes(Map<OwnedAccountKind, String> ownedPrefixes) {
    this.ownedPrefixes = ownedPrefixes;
  }

  public List<String> getCashAccountCodes() {
    return cashAccountCodes;
  }

  public void setCashAccountCodes(List<String> cashAccountCodes) {
    this.cashAccountCodes = cashAccountCodes;
  }

  public BigDecimal getBalanceTolerance() {
    return balanceTolerance;
  }

  public void setBalanceTolerance(BigDecimal balanceTolerance) {
    this.balanceTolerance = balanceTolerance;
  }

  /** Code, names and type of a shared account. */
  public static class AccountDefinition {

    private String code;
    private String name;
    private String localizedName;
    private AccountType type;

    public AccountDefinition() {}

    public AccountDefinition(String code, String name, String localizedName, AccountType type) {
      this.code = code;
      this.name = name;
      this.localizedName = localizedName;
      this.type = type;
    }

    public String getCode() {
      return code;
    }

    public void setCode(String code) {
      this.code = code;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getLocalizedName() {
      return localizedName;
    }

    public void setLocalizedName(String localizedName) {
      this.localizedName = localizedName;
    }

    public AccountType getType() {
      return type;
    }

    public void setType(AccountType type) {
      this.type = type;
    }
  }
}
