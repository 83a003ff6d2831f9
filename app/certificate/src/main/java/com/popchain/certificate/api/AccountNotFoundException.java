/*
 * どこで: Certificate API
 * 何を: アカウントが存在しない (404) ことを表す例外を定義する
 * なぜ: アカウントモジュール未登録の ID への操作を明確に扱うため
 */
package com.popchain.certificate.api;

public class AccountNotFoundException extends RuntimeException {

    public AccountNotFoundException(String accountId) {
        super("account not found: " + accountId);
    }
}
