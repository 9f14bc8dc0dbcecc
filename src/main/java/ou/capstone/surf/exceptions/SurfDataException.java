package ou.capstone.surf.exceptions;

/**
 * Conditions data could not be read or did not make sense.
 */
public class SurfDataException extends Exception
{
    public SurfDataException( final Exception e )
    {
        super( e );
    }

    public SurfDataException( final String msg )
    {
        super( msg );
    }

    public SurfDataException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
