package com.example.hostbackup.jobs;

/**
 * Classificação das falhas devolvidas pelos orquestradores. Nenhuma delas atravessa a fronteira como
 * exceção; todas chegam ao chamador dentro de um resultado estruturado.
 */
public enum JobFailure {
    INVALID_DESTINATION(true),
    DESTINATION_DISABLED(true),
    DIRECTORY_CREATE_FAILED(false),
    ARCHIVE_TOOL_FAILED(false),
    ARTIFACT_MISSING(false),
    RENAME_FAILED(false),
    DATABASE_BACKUP_FAILED(false),
    /** Por arquivo; o job pode terminar parcialmente. */
    TRANSPORT_FAILED(false),
    UNPARSABLE_FILENAME(true),
    RETRIEVAL_FAILED(false),
    VERIFICATION_FAILED(false),
    /** Carrega o exit code da ferramenta externa. */
    RESTORE_TOOL_FAILED(false),
    /** Não fatal: rebaixa o resultado para sucesso com aviso. */
    DATABASE_RESTORE_FAILED(false),
    PROCESS_SPAWN_FAILED(false),
    CANCELLED(false),
    /** Exceção não prevista, capturada na fronteira do orquestrador. */
    UNEXPECTED_ERROR(false);

    private final boolean preflight;

    JobFailure(boolean preflight) {
        this.preflight = preflight;
    }

    /** Falha detectada antes de qualquer efeito colateral. */
    public boolean preflight() {
        return preflight;
    }
}
