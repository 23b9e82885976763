package com.sellerInsight.buyBox.util;

/**
 * Utility class for masking access tokens and other secrets in logs.
 */
public class SecretMasker {
    
    /**
     * Masks a secret for logging.
     * Shows first 4 and last 2 characters, masks the middle.
     * 
     * @param secret The secret to mask
     * @return Masked secret (e.g., "Atza****Xy")
     */
    public static String mask(String secret) {
        if (secret == null || secret.length() <= 8) {
            return "****";
        }
        return secret.substring(0, 4) + "****" + secret.substring(secret.length() - 2);
    }
}
