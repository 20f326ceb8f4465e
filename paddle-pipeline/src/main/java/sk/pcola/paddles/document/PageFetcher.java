package sk.pcola.paddles.document;

/**
 * Stiahnutie stránky a jej sparsovanie. Opakovanie pokusov je vecou implementácie,
 * extrakcia dostane buď dokument, alebo výnimku.
 */
public interface PageFetcher {

    SourceDocument fetch(String url) throws PageFetchException;
}
