package com.alyaman.ledger.service;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.alyaman.ledger.config.AccountPurpose;
import com.alyaman.ledger.config.LedgerProperties;
import com.alyaman.ledger.config.OwnedAccountKind;
import com.alyaman.ledger.domain.Account.AccountType;
import com.alyaman.ledger.domain.PaymentMethod;

/**
 * Maps account purposes and owned-account kinds to concrete account blueprints. All code
 * allocation lives here; {@link AccountService#ensure(AccountBlueprint)} turns a blueprint into a
 * persisted account.
 *
 * <p>Owned accounts are coded {@code <prefix>-<id>} with the id zero-padded to three digits, for
 * example {@code 1251-007} for student 7. Prefixes must be unique per kind so that codes from
 * different kinds can never collide.
 */
@Component
public class ChartOfAccounts {

  /** What an account should look like; {@code parent} is null for top-level accounts. */
  public record AccountBlueprint(
      String code, String name, String localizedName, AccountType type, AccountBlueprint parent) {

    public String parentCode() {
      return parent != null ? parent.code() : null;
    }
  }

  private final LedgerProperties properties;

  public ChartOfAccounts(LedgerProperties properties) {
    this.properties = properties;
    validatePrefixes();
  }

  public AccountBlueprint wellKnown(AccountPurpose purpose) {
    LedgerProperties.AccountDefinition def = properties.account(purpose);
    return new AccountBlueprint(def.getCode(), def.getName(), def.getLocalizedName(), def.getType(), null);
  }

  public AccountBlueprint owned(OwnedAccountKind kind, long ownerId, String ownerName) {
    if (ownerId <= 0) {
      throw new IllegalArgumentException("Owner must be persisted before its accounts: " + kind);
    }
    String code = String.format("%s-%03d", properties.prefix(kind), ownerId);
    return new AccountBlueprint(
        code,
        kind.nameFor(ownerName),
        kind.localizedNameFor(ownerName),
        kind.getType(),
        wellKnown(kind.getParentPurpose()));
  }

  /** Cash for cash payments, the bank account for everything else. */
  public AccountBlueprint paymentAccount(PaymentMethod method) {
    return wellKnown(method == PaymentMethod.CASH ? AccountPurpose.CASH : AccountPurpose.BANK);
  }

  public List<String> cashAccountCodes() {
    return List.copyOf(properties.getCashAccountCodes());
  }

  public BigDecimal balanceTolerance() {
    return properties.getBalanceTolerance();
  }

  private void validatePrefixes() {
    Map<String, OwnedAccountKind> seen = new HashMap<>();
    for (OwnedAccountKind kind : OwnedAccountKind.values()) {
      String prefix = properties.prefix(kind);
      if (prefix.contains("-")) {
        throw new IllegalStateException("Account prefix must not contain '-': " + kind + "=" + prefix);
      }
      OwnedAccountKind clash = seen.putIfAbsent(prefix, kind);
      if (clash != null) {
        throw new IllegalStateException(
            "Account prefix " + prefix + " is shared by " + clash + " and " + kind);
      }
    }
  }
}
